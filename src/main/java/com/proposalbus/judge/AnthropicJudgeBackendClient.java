package com.proposalbus.judge;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * {@link JudgeBackendClient} backed by the Anthropic Messages API.
 * Without an API key every call fails fast, which the judge turns into an abstention.
 */
public class AnthropicJudgeBackendClient implements JudgeBackendClient {

    private final WebClient client;
    private final JudgeProperties.Backend backend;

    public AnthropicJudgeBackendClient(WebClient.Builder builder, JudgeProperties.Backend backend) {
        this.client = builder
            .baseUrl(backend.getBaseUrl())
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.backend = backend;
    }

    @Override
    public Mono<String> complete(JudgeBackendRequest request) {
        if (backend.getApiKey() == null || backend.getApiKey().isBlank()) {
            return Mono.error(new EvaluatorFailedException("no backend API key configured"));
        }
        Map<String, Object> body = Map.of(
            "model", backend.getModel(),
            "max_tokens", backend.getMaxTokens(),
            "system", request.systemPrompt(),
            "messages", List.of(Map.of("role", "user", "content", request.userPrompt()))
        );
        return client.post()
            .uri("/v1/messages")
            .header("x-api-key", backend.getApiKey())
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(response -> {
                JsonNode text = response.path("content").path(0).path("text");
                if (!text.isTextual()) {
                    throw new EvaluatorFailedException("backend response carries no text block");
                }
                return text.asText();
            });
    }
}

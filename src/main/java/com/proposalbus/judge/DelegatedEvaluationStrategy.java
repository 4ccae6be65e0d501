package com.proposalbus.judge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proposalbus.proposal.BatchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Asks the generative backend to pick a winner.
 *
 * <p>A backend error or timeout fails the evaluation (the judge abstains). An answer that
 * cannot be parsed, lacks {@code winner}/{@code reasoning} or names an agent outside the
 * batch is replaced by the rubric verdict.
 */
public class DelegatedEvaluationStrategy implements EvaluationStrategy {

    private static final Logger log = LoggerFactory.getLogger(DelegatedEvaluationStrategy.class);

    private final JudgeBackendClient backend;
    private final JudgeResponseParser parser;
    private final RubricEvaluationStrategy fallback;
    private final ObjectMapper objectMapper;
    private final Duration callTimeout;
    private final int payloadPreviewChars;
    private final Scheduler timer;

    public DelegatedEvaluationStrategy(JudgeBackendClient backend,
                                       JudgeResponseParser parser,
                                       RubricEvaluationStrategy fallback,
                                       ObjectMapper objectMapper,
                                       Duration callTimeout,
                                       int payloadPreviewChars,
                                       Scheduler timer) {
        this.backend = backend;
        this.parser = parser;
        this.fallback = fallback;
        this.objectMapper = objectMapper;
        this.callTimeout = callTimeout;
        this.payloadPreviewChars = payloadPreviewChars;
        this.timer = timer;
    }

    @Override
    public Mono<Assessment> evaluate(JudgeSpecialty specialty, BatchSummary summary) {
        if (summary.isEmpty()) {
            return Mono.error(new EvaluatorFailedException("no proposals to evaluate"));
        }
        JudgeBackendRequest request = JudgeBackendRequest.of(specialty, summary, payloadPreviewChars, this::render);
        return Mono.defer(() -> backend.complete(request))
            .timeout(callTimeout, timer)
            .onErrorMap(TimeoutException.class,
                ex -> new EvaluatorFailedException("backend call timed out after " + callTimeout.toMillis() + "ms"))
            .onErrorMap(ex -> !(ex instanceof EvaluatorFailedException),
                ex -> new EvaluatorFailedException("backend call failed: " + ex.getMessage(), ex))
            .map(answer -> interpret(specialty, summary, answer));
    }

    private Assessment interpret(JudgeSpecialty specialty, BatchSummary summary, String answer) {
        JudgeResponseParser.ParsedJudgement parsed;
        try {
            parsed = parser.parse(answer);
        } catch (EvaluatorFailedException ex) {
            log.warn("{} judge answer unusable ({}); using rubric", specialty.getValue(), ex.getMessage());
            return fallback.assess(specialty, summary);
        }
        if (!summary.hasAgent(parsed.winner())) {
            log.warn("{} judge named unknown agent {}; using rubric", specialty.getValue(), parsed.winner());
            return fallback.assess(specialty, summary);
        }
        return new Assessment(parsed.winner(), parsed.reasoning(), parsed.confidence(), parsed.concerns(),
            Map.of(), EvaluationSource.DELEGATED);
    }

    private String render(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            return String.valueOf(payload);
        }
    }
}

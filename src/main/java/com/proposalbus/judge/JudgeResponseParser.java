package com.proposalbus.judge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proposalbus.proposal.Confidence;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Extracts {@code {winner, reasoning, confidence, concerns}} from free-form backend text:
 * markdown fences are dropped and the first balanced {@code {...}} span is parsed.
 */
public class JudgeResponseParser {

    private static final Pattern FENCE = Pattern.compile("```[A-Za-z]*");

    private final ObjectMapper objectMapper;

    public JudgeResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record ParsedJudgement(String winner, String reasoning, Confidence confidence, List<String> concerns) {}

    public ParsedJudgement parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new EvaluatorFailedException("backend returned an empty answer");
        }
        String json = firstBalancedObject(FENCE.matcher(raw).replaceAll(""));
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new EvaluatorFailedException("backend answer is not valid JSON", ex);
        }
        String winner = text(root, "winner");
        String reasoning = text(root, "reasoning");
        if (winner == null || reasoning == null) {
            throw new EvaluatorFailedException("backend answer lacks winner or reasoning");
        }
        return new ParsedJudgement(winner, reasoning, Confidence.fromValue(text(root, "confidence")),
            concerns(root.get("concerns")));
    }

    static String firstBalancedObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            throw new EvaluatorFailedException("backend answer contains no JSON object");
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        throw new EvaluatorFailedException("backend answer has an unterminated JSON object");
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static List<String> concerns(JsonNode node) {
        List<String> concerns = new ArrayList<>();
        if (node == null || node.isNull()) {
            return concerns;
        }
        if (node.isArray()) {
            node.forEach(item -> concerns.add(item.asText()));
        } else {
            concerns.add(node.asText());
        }
        return concerns;
    }
}

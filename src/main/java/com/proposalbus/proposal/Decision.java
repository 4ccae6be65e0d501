package com.proposalbus.proposal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The binding outcome of a batch. A simplified-mode decision carries
 * {@code authoritative = false} and a display-only vote breakdown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Decision(
    @JsonProperty("id") String id,
    @JsonProperty("batch_id") String batchId,
    @JsonProperty("winning_agent_id") String winningAgentId,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("confidence") Confidence confidence,
    @JsonProperty("concerns") List<String> concerns,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("method") DecisionMethod method,
    @JsonProperty("authoritative") boolean authoritative,
    @JsonProperty("vote_breakdown") Map<String, Double> voteBreakdown
) {

    public Decision {
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
        voteBreakdown = voteBreakdown == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(voteBreakdown));
    }

    public static Decision panel(String batchId, String winningAgentId, String rationale,
                                 Confidence confidence, List<String> concerns) {
        return new Decision(newId(), batchId, winningAgentId, rationale, confidence, concerns,
            Instant.now(), DecisionMethod.PANEL, true, null);
    }

    public static Decision degraded(String batchId, String winningAgentId, String rationale, List<String> concerns) {
        return new Decision(newId(), batchId, winningAgentId, rationale, Confidence.LOW, concerns,
            Instant.now(), DecisionMethod.DEGRADED, true, null);
    }

    public static Decision simplified(String batchId, String winningAgentId, Map<String, Double> voteBreakdown) {
        return new Decision(newId(), batchId, winningAgentId,
            "Simplified selection: winner drawn at random, vote shares are illustrative only",
            Confidence.LOW, List.of("non-authoritative: simplified mode"),
            Instant.now(), DecisionMethod.SIMPLIFIED, false, voteBreakdown);
    }

    private static String newId() {
        return "dec-" + UUID.randomUUID().toString().substring(0, 8);
    }
}

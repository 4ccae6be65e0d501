package com.proposalbus.judge;

import com.proposalbus.proposal.Confidence;

import java.util.List;
import java.util.Map;

/**
 * What an {@link EvaluationStrategy} concluded, before the judge attaches its identity and weight.
 */
public record Assessment(
    String winner,
    String rationale,
    Confidence confidence,
    List<String> concerns,
    Map<String, Double> scores,
    EvaluationSource source
) {

    public Assessment {
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
        scores = scores == null ? Map.of() : scores;
    }
}

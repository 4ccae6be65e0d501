package com.proposalbus.judge;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalbus.proposal.Confidence;

import java.util.List;
import java.util.Map;

/**
 * One judge's vote on a batch. A weight of zero marks an abstention that never counts.
 */
public record Evaluation(
    @JsonProperty("judge_id") String judgeId,
    @JsonProperty("specialty") JudgeSpecialty specialty,
    @JsonProperty("weight") double weight,
    @JsonProperty("winner") String winner,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("confidence") Confidence confidence,
    @JsonProperty("concerns") List<String> concerns,
    @JsonProperty("source") EvaluationSource source,
    @JsonProperty("scores") Map<String, Double> scores
) {

    public Evaluation {
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
        scores = scores == null ? Map.of() : scores;
    }

    public static Evaluation of(String judgeId, JudgeSpecialty specialty, double weight, Assessment assessment) {
        return new Evaluation(judgeId, specialty, weight, assessment.winner(), assessment.rationale(),
            assessment.confidence(), assessment.concerns(), assessment.source(), assessment.scores());
    }

    public static Evaluation abstention(String judgeId, JudgeSpecialty specialty, String reason) {
        return new Evaluation(judgeId, specialty, 0.0, null, reason, Confidence.LOW,
            List.of(reason), EvaluationSource.ABSTAINED, Map.of());
    }

    @JsonIgnore
    public boolean isUsable() {
        return weight > 0 && winner != null;
    }
}

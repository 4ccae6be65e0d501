package com.proposalbus.judge;

import com.proposalbus.proposal.Confidence;
import com.proposalbus.proposal.Decision;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Folds usable evaluations into one decision.
 *
 * <p>Each evaluation adds its weight to the candidate it voted for. The heaviest candidate
 * wins; equal weights are resolved by the {@link TieBreakPolicy}. Confidence is the mean of
 * the winner's supporters. A "close decision" concern is raised when the runner-up trails by
 * less than {@code closeMargin}, and "low consensus" when supporters are fewer than
 * {@code consensusThreshold} of the configured panel.
 */
public class WeightedVoteAggregator {

    private static final double EPSILON = 1e-9;
    private static final String ELLIPSIS = "...";

    private final TieBreakPolicy tieBreak;
    private final double consensusThreshold;
    private final double closeMargin;
    private final int rationaleMaxLength;

    public WeightedVoteAggregator(TieBreakPolicy tieBreak, double consensusThreshold,
                                  double closeMargin, int rationaleMaxLength) {
        if (rationaleMaxLength <= ELLIPSIS.length()) {
            throw new IllegalArgumentException("rationale max length must exceed " + ELLIPSIS.length());
        }
        this.tieBreak = tieBreak;
        this.consensusThreshold = consensusThreshold;
        this.closeMargin = closeMargin;
        this.rationaleMaxLength = rationaleMaxLength;
    }

    public Decision aggregate(String batchId, List<Evaluation> evaluations, int panelSize) {
        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (Evaluation evaluation : evaluations) {
            if (!evaluation.isUsable()) {
                continue;
            }
            tallies.computeIfAbsent(evaluation.winner(), Tally::new).add(evaluation);
        }
        if (tallies.isEmpty()) {
            throw new NoUsableEvaluationsException(batchId);
        }

        Tally winner = null;
        for (Tally candidate : tallies.values()) {
            if (winner == null || candidate.weight > winner.weight + EPSILON
                || (Math.abs(candidate.weight - winner.weight) <= EPSILON && prefers(candidate, winner))) {
                winner = candidate;
            }
        }

        double runnerUp = Double.NEGATIVE_INFINITY;
        for (Tally candidate : tallies.values()) {
            if (candidate != winner) {
                runnerUp = Math.max(runnerUp, candidate.weight);
            }
        }

        List<String> concerns = new ArrayList<>();
        if (runnerUp != Double.NEGATIVE_INFINITY && winner.weight - runnerUp < closeMargin) {
            concerns.add(String.format(Locale.ROOT, "close decision: margin < %.1f", closeMargin));
        }
        if (winner.supporters.size() < consensusThreshold * panelSize) {
            concerns.add(String.format(Locale.ROOT, "low consensus: %d of %d judges",
                winner.supporters.size(), panelSize));
        }

        return Decision.panel(batchId, winner.agentId, rationale(winner.supporters),
            Confidence.fromMeanScore(winner.meanConfidence()), concerns);
    }

    private boolean prefers(Tally candidate, Tally incumbent) {
        if (tieBreak == TieBreakPolicy.HIGHEST_AVERAGE_CONFIDENCE) {
            return candidate.meanConfidence() > incumbent.meanConfidence() + EPSILON;
        }
        // first seen keeps the lead
        return false;
    }

    private String rationale(List<Evaluation> supporters) {
        List<String> parts = new ArrayList<>();
        for (Evaluation evaluation : supporters) {
            parts.add(evaluation.specialty().getValue() + ": " + evaluation.rationale());
        }
        String joined = String.join(" | ", parts);
        if (joined.length() <= rationaleMaxLength) {
            return joined;
        }
        return joined.substring(0, rationaleMaxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static final class Tally {

        private final String agentId;
        private final List<Evaluation> supporters = new ArrayList<>();
        private double weight;

        private Tally(String agentId) {
            this.agentId = agentId;
        }

        private void add(Evaluation evaluation) {
            supporters.add(evaluation);
            weight += evaluation.weight();
        }

        private double meanConfidence() {
            return supporters.stream().mapToInt(e -> e.confidence().getScore()).average().orElse(1.0);
        }
    }
}

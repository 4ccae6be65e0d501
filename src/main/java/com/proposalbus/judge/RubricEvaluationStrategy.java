package com.proposalbus.judge;

import com.proposalbus.proposal.BatchSummary;
import com.proposalbus.proposal.Confidence;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Deterministic scoring used when no generative backend is configured and as the fallback
 * for unparsable backend answers.
 *
 * <p>Each proposal gets an additive rubric score for the specialty plus a perturbation drawn
 * uniformly from [-1, 1) to split exact ties. The highest score wins; on an exact tie the
 * earlier proposal keeps the lead. Confidence follows the score spread: above 3 is high,
 * below 1 is low.
 */
public class RubricEvaluationStrategy implements EvaluationStrategy {

    static final double WEAK_SCORE = 2.0;

    private final RandomGenerator random;

    public RubricEvaluationStrategy(RandomGenerator random) {
        this.random = random;
    }

    @Override
    public Mono<Assessment> evaluate(JudgeSpecialty specialty, BatchSummary summary) {
        return Mono.fromCallable(() -> assess(specialty, summary));
    }

    public Assessment assess(JudgeSpecialty specialty, BatchSummary summary) {
        if (summary.isEmpty()) {
            throw new EvaluatorFailedException("no proposals to evaluate");
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        String winner = null;
        double best = Double.NEGATIVE_INFINITY;
        for (BatchSummary.ProposalSummary proposal : summary.proposals()) {
            double score = score(specialty, proposal) + (random.nextDouble() * 2 - 1);
            scores.put(proposal.agentId(), score);
            if (score > best) {
                best = score;
                winner = proposal.agentId();
            }
        }

        double worst = scores.values().stream().mapToDouble(Double::doubleValue).min().orElse(best);
        double spread = best - worst;
        Confidence confidence = spread > 3 ? Confidence.HIGH : spread < 1 ? Confidence.LOW : Confidence.MEDIUM;

        long weak = scores.values().stream().filter(s -> s < WEAK_SCORE).count();
        List<String> concerns = new ArrayList<>();
        if (weak > 0) {
            concerns.add(weak + " weak proposals");
        }

        String rationale = String.format(Locale.ROOT, "%s evaluation: %s scored %.1f across %d proposal(s)",
            specialty.getValue(), winner, best, scores.size());
        return new Assessment(winner, rationale, confidence, concerns, scores, EvaluationSource.RUBRIC);
    }

    /**
     * Rubric points for one proposal, without perturbation.
     */
    public static double score(JudgeSpecialty specialty, BatchSummary.ProposalSummary proposal) {
        Map<String, Object> payload = proposal.payload();
        String rationale = proposal.rationale() == null ? "" : proposal.rationale();
        String text = rationale.toLowerCase(Locale.ROOT);
        double score = 0;
        switch (specialty) {
            case TECHNICAL -> {
                Object position = payload.get("position");
                if (position != null) {
                    score += 3;
                }
                if (payload.get("element_type") != null) {
                    score += 2;
                }
                score += verticalOf(position) >= 0 ? 2 : -1;
            }
            case STORY -> {
                if (payload.get("story_beat") != null) {
                    score += 3;
                }
                if (payload.get("choices") instanceof List<?> choices && !choices.isEmpty()) {
                    score += 2;
                }
                if (text.contains("narrative") || text.contains("story")) {
                    score += 1;
                }
            }
            case AUDIENCE -> {
                if (text.contains("engagement") || text.contains("audience")) {
                    score += 3;
                }
                if (payload.get("choices") != null) {
                    score += 2;
                }
                if (rationale.length() > 50) {
                    score += 1;
                }
            }
            case VISUAL -> {
                if (payload.get("position") != null || payload.get("target_position") != null) {
                    score += 2;
                }
                if (payload.get("color") != null || payload.get("scale") != null) {
                    score += 2;
                }
                if (text.contains("visual") || text.contains("dramatic")) {
                    score += 2;
                }
            }
        }
        return score;
    }

    private static double verticalOf(Object position) {
        if (position instanceof List<?> coordinates && coordinates.size() > 2
            && coordinates.get(2) instanceof Number vertical) {
            return vertical.doubleValue();
        }
        return -1;
    }
}

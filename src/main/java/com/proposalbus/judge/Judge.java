package com.proposalbus.judge;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalbus.proposal.BatchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A weighted, specialty-scoped evaluator. {@link #evaluate} never fails: any problem
 * becomes a zero-weight abstention.
 */
public class Judge {

    private static final Logger log = LoggerFactory.getLogger(Judge.class);

    private final String id;
    private final JudgeSpecialty specialty;
    private final double weight;
    private final EvaluationStrategy strategy;

    private final AtomicLong decisionsRendered = new AtomicLong();
    private final AtomicLong abstentions = new AtomicLong();
    private final AtomicLong totalDecisionMillis = new AtomicLong();
    private final AtomicLong totalConfidenceScore = new AtomicLong();

    public Judge(String id, JudgeSpecialty specialty, double weight, EvaluationStrategy strategy) {
        if (weight < 0) {
            throw new IllegalArgumentException("judge weight must be >= 0");
        }
        this.id = id;
        this.specialty = specialty;
        this.weight = weight;
        this.strategy = strategy;
    }

    public Mono<Evaluation> evaluate(BatchSummary summary) {
        if (summary.isEmpty()) {
            abstentions.incrementAndGet();
            return Mono.just(Evaluation.abstention(id, specialty, "no proposals to evaluate"));
        }
        long startedAt = System.nanoTime();
        return Mono.defer(() -> strategy.evaluate(specialty, summary))
            .map(assessment -> Evaluation.of(id, specialty, weight, assessment))
            .doOnNext(evaluation -> {
                decisionsRendered.incrementAndGet();
                totalDecisionMillis.addAndGet(Duration.ofNanos(System.nanoTime() - startedAt).toMillis());
                totalConfidenceScore.addAndGet(evaluation.confidence().getScore());
                log.debug("Judge {} picked {} for batch {} ({})", id, evaluation.winner(), summary.batchId(),
                    evaluation.source().getValue());
            })
            .onErrorResume(ex -> {
                abstentions.incrementAndGet();
                log.warn("Judge {} abstains on batch {}: {}", id, summary.batchId(), ex.getMessage());
                return Mono.just(Evaluation.abstention(id, specialty, "evaluation failed: " + ex.getMessage()));
            });
    }

    public String getId() {
        return id;
    }

    public JudgeSpecialty getSpecialty() {
        return specialty;
    }

    public double getWeight() {
        return weight;
    }

    public Stats stats() {
        long rendered = decisionsRendered.get();
        return new Stats(id, specialty, weight, rendered, abstentions.get(),
            rendered == 0 ? 0.0 : (double) totalDecisionMillis.get() / rendered,
            rendered == 0 ? 0.0 : (double) totalConfidenceScore.get() / rendered);
    }

    public record Stats(
        @JsonProperty("judge_id") String judgeId,
        @JsonProperty("specialty") JudgeSpecialty specialty,
        @JsonProperty("weight") double weight,
        @JsonProperty("decisions_rendered") long decisionsRendered,
        @JsonProperty("abstentions") long abstentions,
        @JsonProperty("average_decision_ms") double averageDecisionMillis,
        @JsonProperty("average_confidence") double averageConfidence
    ) {}
}

package com.proposalbus.judge;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalbus.bus.EventBusService;
import com.proposalbus.contract.EventPayload;
import com.proposalbus.contract.EventTypes;
import com.proposalbus.proposal.BatchSummary;
import com.proposalbus.proposal.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs every configured judge on a batch at once and reduces their votes to one decision.
 * When no judge produced a usable vote the decision degrades to the first submitted proposal.
 */
public class JudgePanel {

    private static final Logger log = LoggerFactory.getLogger(JudgePanel.class);

    static final String PANEL_FAILURE = "panel failure: no usable evaluations";

    private final List<Judge> judges;
    private final WeightedVoteAggregator aggregator;
    private final EventBusService bus;

    private final AtomicLong batchesEvaluated = new AtomicLong();
    private final AtomicLong unanimousBatches = new AtomicLong();
    private final AtomicLong degradedBatches = new AtomicLong();
    private final AtomicLong totalEvaluationMillis = new AtomicLong();

    public JudgePanel(List<Judge> judges, WeightedVoteAggregator aggregator, EventBusService bus) {
        if (judges.isEmpty()) {
            throw new IllegalArgumentException("a panel needs at least one judge");
        }
        this.judges = List.copyOf(judges);
        this.aggregator = aggregator;
        this.bus = bus;
    }

    /**
     * Evaluates a non-empty batch. Publishes {@code judge:decision_made} before completing.
     */
    public Mono<PanelVerdict> evaluateBatch(BatchSummary summary) {
        if (summary.isEmpty()) {
            return Mono.error(new NoUsableEvaluationsException(summary.batchId()));
        }
        long startedAt = System.nanoTime();
        return Flux.fromIterable(judges)
            .flatMapSequential(judge -> judge.evaluate(summary))
            .collectList()
            .map(evaluations -> {
                long elapsed = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
                PanelVerdict verdict = new PanelVerdict(decide(summary, evaluations), evaluations, elapsed);
                record(verdict);
                bus.publish(EventTypes.JUDGE_DECISION_MADE, new EventPayload.PanelDecided(
                    summary.batchId(), verdict.decision(), verdict.evaluations(), elapsed));
                return verdict;
            });
    }

    private Decision decide(BatchSummary summary, List<Evaluation> evaluations) {
        try {
            Decision decision = aggregator.aggregate(summary.batchId(), evaluations, judges.size());
            log.info("Panel picked {} for batch {} (confidence={}, concerns={})", decision.winningAgentId(),
                summary.batchId(), decision.confidence().getValue(), decision.concerns());
            return decision;
        } catch (NoUsableEvaluationsException ex) {
            String fallbackWinner = summary.proposals().get(0).agentId();
            log.warn("{}; degrading to first proposal from {}", ex.getMessage(), fallbackWinner);
            degradedBatches.incrementAndGet();
            return Decision.degraded(summary.batchId(), fallbackWinner,
                "No judge produced a usable evaluation; first submitted proposal selected",
                List.of(PANEL_FAILURE));
        }
    }

    private void record(PanelVerdict verdict) {
        batchesEvaluated.incrementAndGet();
        totalEvaluationMillis.addAndGet(verdict.evaluationTimeMs());
        List<Evaluation> usable = verdict.evaluations().stream().filter(Evaluation::isUsable).toList();
        if (!usable.isEmpty() && usable.stream().allMatch(e -> e.winner().equals(usable.get(0).winner()))) {
            unanimousBatches.incrementAndGet();
        }
    }

    public List<Judge> getJudges() {
        return judges;
    }

    public Stats stats() {
        long evaluated = batchesEvaluated.get();
        return new Stats(evaluated, degradedBatches.get(),
            evaluated == 0 ? 0.0 : (double) totalEvaluationMillis.get() / evaluated,
            evaluated == 0 ? 0.0 : (double) unanimousBatches.get() / evaluated,
            judges.stream().map(Judge::stats).toList());
    }

    public record Stats(
        @JsonProperty("batches_evaluated") long batchesEvaluated,
        @JsonProperty("degraded_batches") long degradedBatches,
        @JsonProperty("average_evaluation_ms") double averageEvaluationMillis,
        @JsonProperty("consensus_rate") double consensusRate,
        @JsonProperty("judges") List<Judge.Stats> judges
    ) {}
}

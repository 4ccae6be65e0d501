package com.proposalbus.proposal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.concurrent.atomic.AtomicLong;

public class BatchMetrics {

    private final AtomicLong batchesCreated = new AtomicLong();
    private final AtomicLong batchesCompleted = new AtomicLong();
    private final AtomicLong batchesCancelled = new AtomicLong();
    private final AtomicLong forcedAdvances = new AtomicLong();
    private final AtomicLong totalDecisionMillis = new AtomicLong();
    private final AtomicLong totalEstimatedTextSize = new AtomicLong();

    void batchCreated() {
        batchesCreated.incrementAndGet();
    }

    void batchCancelled() {
        batchesCancelled.incrementAndGet();
    }

    void forcedAdvance() {
        forcedAdvances.incrementAndGet();
    }

    void batchCompleted(long decisionMillis, long estimatedTextSize) {
        batchesCompleted.incrementAndGet();
        totalDecisionMillis.addAndGet(decisionMillis);
        totalEstimatedTextSize.addAndGet(estimatedTextSize);
    }

    public Snapshot snapshot() {
        long completed = batchesCompleted.get();
        double average = completed == 0 ? 0.0 : (double) totalDecisionMillis.get() / completed;
        return new Snapshot(batchesCreated.get(), completed, batchesCancelled.get(), forcedAdvances.get(),
            average, totalEstimatedTextSize.get());
    }

    public record Snapshot(
        @JsonProperty("batches_created") long batchesCreated,
        @JsonProperty("batches_completed") long batchesCompleted,
        @JsonProperty("batches_cancelled") long batchesCancelled,
        @JsonProperty("forced_advances") long forcedAdvances,
        @JsonProperty("average_decision_ms") double averageDecisionMillis,
        @JsonProperty("total_estimated_text_size") long totalEstimatedTextSize
    ) {}
}

package com.proposalbus.bus;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters maintained by {@link EventBusService}.
 */
public class BusMetrics {

    private final AtomicLong eventsEmitted = new AtomicLong();
    private final AtomicLong dispatchesProcessed = new AtomicLong();
    private final AtomicLong dispatchesFailed = new AtomicLong();
    private final AtomicLong handlerFailures = new AtomicLong();
    private final AtomicLong totalDispatchMillis = new AtomicLong();

    void eventEmitted() {
        eventsEmitted.incrementAndGet();
    }

    void dispatchCompleted(long elapsedMillis, long failedHandlers) {
        dispatchesProcessed.incrementAndGet();
        totalDispatchMillis.addAndGet(elapsedMillis);
        if (failedHandlers > 0) {
            dispatchesFailed.incrementAndGet();
            handlerFailures.addAndGet(failedHandlers);
        }
    }

    public Snapshot snapshot() {
        long processed = dispatchesProcessed.get();
        double average = processed == 0 ? 0.0 : (double) totalDispatchMillis.get() / processed;
        return new Snapshot(eventsEmitted.get(), processed, dispatchesFailed.get(), handlerFailures.get(), average);
    }

    public record Snapshot(
        @JsonProperty("events_emitted") long eventsEmitted,
        @JsonProperty("dispatches_processed") long dispatchesProcessed,
        @JsonProperty("dispatches_failed") long dispatchesFailed,
        @JsonProperty("handler_failures") long handlerFailures,
        @JsonProperty("average_dispatch_ms") double averageDispatchMillis
    ) {}
}

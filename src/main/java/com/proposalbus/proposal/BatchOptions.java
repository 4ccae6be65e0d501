package com.proposalbus.proposal;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Per-batch overrides; null members fall back to {@link BatchProperties}.
 *
 * <p>{@code onRegistered} runs once the batch is known to the manager and before its
 * deadline is armed or {@code proposal:batch_created} is published, so callers can start
 * tracking the batch before any of its events can reach them.
 */
public record BatchOptions(QuorumRule quorumRule, Duration collectionTimeout, Consumer<BatchView> onRegistered) {

    public BatchOptions(QuorumRule quorumRule, Duration collectionTimeout) {
        this(quorumRule, collectionTimeout, null);
    }

    public static BatchOptions defaults() {
        return new BatchOptions(null, null);
    }
}

package com.proposalbus.bus;

import java.time.Duration;

/**
 * Per-subscription dispatch settings. A null timeout or retry count falls back to the
 * bus defaults from {@link EventBusProperties}.
 */
public record SubscriptionOptions(int priority, boolean once, Duration timeout, Integer retries) {

    public static SubscriptionOptions defaults() {
        return new SubscriptionOptions(0, false, null, null);
    }

    public static SubscriptionOptions priority(int priority) {
        return new SubscriptionOptions(priority, false, null, null);
    }

    public SubscriptionOptions withOnce() {
        return new SubscriptionOptions(priority, true, timeout, retries);
    }

    public SubscriptionOptions withTimeout(Duration timeout) {
        return new SubscriptionOptions(priority, once, timeout, retries);
    }

    public SubscriptionOptions withRetries(int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0");
        }
        return new SubscriptionOptions(priority, once, timeout, retries);
    }
}

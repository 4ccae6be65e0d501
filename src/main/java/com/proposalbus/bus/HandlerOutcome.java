package com.proposalbus.bus;

/**
 * Per-handler result of one dispatch. Failures are values here, never errors of the
 * dispatch itself.
 */
public record HandlerOutcome(
    String subscriptionId,
    int priority,
    boolean succeeded,
    HandlerResult result,
    Throwable error,
    int attempts
) {

    public static HandlerOutcome success(String subscriptionId, int priority, HandlerResult result, int attempts) {
        return new HandlerOutcome(subscriptionId, priority, true, result, null, attempts);
    }

    public static HandlerOutcome failure(String subscriptionId, int priority, Throwable error, int attempts) {
        return new HandlerOutcome(subscriptionId, priority, false, null, error, attempts);
    }

    public boolean stopsPropagation() {
        return succeeded && result != null && result.stopPropagation();
    }
}

package com.proposalbus.bus;

public class HandlerExhaustedException extends RuntimeException {

    private final int attempts;

    public HandlerExhaustedException(String eventType, String subscriptionId, int attempts, Throwable lastFailure) {
        super("handler " + subscriptionId + " for " + eventType + " failed after " + attempts + " attempts: "
            + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}

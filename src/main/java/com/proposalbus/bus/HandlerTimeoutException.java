package com.proposalbus.bus;

import java.time.Duration;

public class HandlerTimeoutException extends RuntimeException {

    public HandlerTimeoutException(String eventType, String subscriptionId, Duration timeout) {
        super("handler " + subscriptionId + " for " + eventType + " timed out after " + timeout.toMillis() + "ms");
    }
}

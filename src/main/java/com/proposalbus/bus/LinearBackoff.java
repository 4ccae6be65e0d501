package com.proposalbus.bus;

import java.time.Duration;

/**
 * Retry delay as a pure function of the attempt number: {@code base * attempt}.
 */
public record LinearBackoff(Duration base) {

    public Duration delayFor(long attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt numbers start at 1");
        }
        return base.multipliedBy(attempt);
    }
}

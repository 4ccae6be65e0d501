package com.proposalbus.competition;

import java.time.Duration;
import java.util.Set;

/**
 * Optional knobs for {@link CompetitionOrchestrator#start}. An expected-agent set takes
 * precedence over a quorum minimum; null members use configured defaults.
 */
public record StartOptions(Set<String> expectedAgents, Integer quorumMinimum, Duration timeout) {

    public static StartOptions defaults() {
        return new StartOptions(null, null, null);
    }

    public static StartOptions expecting(Set<String> expectedAgents) {
        return new StartOptions(expectedAgents, null, null);
    }

    public StartOptions withTimeout(Duration timeout) {
        return new StartOptions(expectedAgents, quorumMinimum, timeout);
    }
}

package com.proposalbus.proposal;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * When a batch has heard from enough agents to be judged.
 */
public sealed interface QuorumRule {

    boolean isSatisfiedBy(Set<String> submittedAgentIds);

    static QuorumRule expectedAgents(Set<String> agentIds) {
        return new ExpectedAgents(agentIds);
    }

    static QuorumRule minimumCount(int minimum) {
        return new MinimumCount(minimum);
    }

    record ExpectedAgents(Set<String> agentIds) implements QuorumRule {

        public ExpectedAgents {
            if (agentIds == null || agentIds.isEmpty()) {
                throw new IllegalArgumentException("expected agent set must not be empty");
            }
            agentIds = Collections.unmodifiableSet(new LinkedHashSet<>(agentIds));
        }

        @Override
        public boolean isSatisfiedBy(Set<String> submittedAgentIds) {
            return submittedAgentIds.containsAll(agentIds);
        }
    }

    record MinimumCount(int minimum) implements QuorumRule {

        public MinimumCount {
            if (minimum < 1) {
                throw new IllegalArgumentException("quorum minimum must be >= 1");
            }
        }

        @Override
        public boolean isSatisfiedBy(Set<String> submittedAgentIds) {
            return submittedAgentIds.size() >= minimum;
        }
    }
}

package com.proposalbus.proposal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalbus.contract.AgentCategory;
import com.proposalbus.contract.ProposalKind;

import java.util.List;
import java.util.Map;

/**
 * Immutable view of a batch handed to judging.
 */
public record BatchSummary(
    @JsonProperty("batch_id") String batchId,
    @JsonProperty("kind") ProposalKind kind,
    @JsonProperty("context") Map<String, Object> context,
    @JsonProperty("proposals") List<ProposalSummary> proposals,
    @JsonProperty("forced_by_deadline") boolean forcedByDeadline
) {

    public BatchSummary {
        proposals = List.copyOf(proposals);
    }

    public boolean isEmpty() {
        return proposals.isEmpty();
    }

    public boolean hasAgent(String agentId) {
        return proposals.stream().anyMatch(p -> p.agentId().equals(agentId));
    }

    public record ProposalSummary(
        @JsonProperty("proposal_id") String proposalId,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("agent_category") AgentCategory agentCategory,
        @JsonProperty("kind") ProposalKind kind,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("rationale") String rationale,
        @JsonProperty("priority_class") int priorityClass
    ) {

        static ProposalSummary of(Proposal proposal) {
            return new ProposalSummary(proposal.getId(), proposal.getAgentId(), proposal.getAgentCategory(),
                proposal.getKind(), proposal.getPayload(), proposal.getRationale(),
                proposal.getMetadata().priorityClass());
        }
    }
}

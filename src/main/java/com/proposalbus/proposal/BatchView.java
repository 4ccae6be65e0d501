package com.proposalbus.proposal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalbus.contract.ProposalKind;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time snapshot of a batch for observers.
 */
public record BatchView(
    @JsonProperty("batch_id") String batchId,
    @JsonProperty("request_id") String requestId,
    @JsonProperty("kind") ProposalKind kind,
    @JsonProperty("status") BatchStatus status,
    @JsonProperty("proposals") List<ProposalView> proposals,
    @JsonProperty("decision") Decision decision,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("decided_at") Instant decidedAt,
    @JsonProperty("forced_by_deadline") boolean forcedByDeadline,
    @JsonProperty("cancellation_reason") String cancellationReason
) {

    public BatchView {
        proposals = List.copyOf(proposals);
    }

    public record ProposalView(
        @JsonProperty("proposal_id") String proposalId,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("status") ProposalStatus status,
        @JsonProperty("rationale") String rationale,
        @JsonProperty("metadata") ProposalMetadata metadata
    ) {

        static ProposalView of(Proposal proposal) {
            return new ProposalView(proposal.getId(), proposal.getAgentId(), proposal.getStatus(),
                proposal.getRationale(), proposal.getMetadata());
        }
    }
}

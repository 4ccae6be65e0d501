package com.proposalbus.proposal;

import com.proposalbus.contract.AgentCategory;
import com.proposalbus.contract.ProposalDraft;
import com.proposalbus.contract.ProposalKind;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One agent's candidate answer inside a batch. Only the status changes after creation, and
 * only once, away from {@link ProposalStatus#PENDING}.
 */
public class Proposal {

    private final String id;
    private final String agentId;
    private final AgentCategory agentCategory;
    private final ProposalKind kind;
    private final Map<String, Object> payload;
    private final String rationale;
    private final Instant timestamp;
    private final ProposalMetadata metadata;
    private volatile ProposalStatus status = ProposalStatus.PENDING;

    private Proposal(ProposalDraft draft) {
        this.id = "prop_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
        this.agentId = draft.agentId();
        this.agentCategory = draft.agentCategory();
        this.kind = draft.kind();
        this.payload = draft.payload();
        this.rationale = draft.rationale();
        this.timestamp = Instant.now();
        this.metadata = ProposalMetadata.derive(draft);
    }

    public static Proposal fromDraft(ProposalDraft draft) {
        return new Proposal(draft);
    }

    synchronized void markSelected() {
        transitionTo(ProposalStatus.SELECTED);
    }

    synchronized void markRejected() {
        transitionTo(ProposalStatus.REJECTED);
    }

    private void transitionTo(ProposalStatus next) {
        if (status != ProposalStatus.PENDING) {
            throw new IllegalStateException("proposal " + id + " is already " + status.getValue());
        }
        status = next;
    }

    public String getId() {
        return id;
    }

    public String getAgentId() {
        return agentId;
    }

    public AgentCategory getAgentCategory() {
        return agentCategory;
    }

    public ProposalKind getKind() {
        return kind;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public String getRationale() {
        return rationale;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ProposalMetadata getMetadata() {
        return metadata;
    }

    public ProposalStatus getStatus() {
        return status;
    }
}

package com.proposalbus.proposal;

import com.proposalbus.contract.ProposalKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Mutable batch state. Owned by {@link BatchManager}, which serializes every mutation.
 */
public class ProposalBatch {

    private final String id;
    private final String requestId;
    private final ProposalKind kind;
    private final Map<String, Object> context;
    private final QuorumRule quorumRule;
    private final Duration collectionTimeout;
    private final Instant createdAt;
    // keyed by agent id, in first-submission order
    private final LinkedHashMap<String, Proposal> proposals = new LinkedHashMap<>();
    private BatchStatus status = BatchStatus.COLLECTING;
    private Decision decision;
    private Instant decidedAt;
    private boolean forcedByDeadline;
    private String cancellationReason;

    ProposalBatch(String requestId, ProposalKind kind, Map<String, Object> context,
                  QuorumRule quorumRule, Duration collectionTimeout) {
        this.id = "batch_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
        this.requestId = requestId;
        this.kind = kind;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.quorumRule = quorumRule;
        this.collectionTimeout = collectionTimeout;
        this.createdAt = Instant.now();
    }

    /**
     * @return the proposal this one replaced, or null
     */
    Proposal putProposal(Proposal proposal) {
        return proposals.put(proposal.getAgentId(), proposal);
    }

    boolean isQuorumMet() {
        return quorumRule.isSatisfiedBy(proposals.keySet());
    }

    void markReadyForJudging(boolean forced) {
        status = BatchStatus.READY_FOR_JUDGING;
        forcedByDeadline = forced;
    }

    void markJudging() {
        status = BatchStatus.JUDGING;
    }

    void cancel(String reason) {
        status = BatchStatus.CANCELLED;
        cancellationReason = reason;
    }

    void decide(Decision decision) {
        Proposal winner = proposals.get(decision.winningAgentId());
        winner.markSelected();
        for (Proposal proposal : proposals.values()) {
            if (proposal != winner) {
                proposal.markRejected();
            }
        }
        this.decision = decision;
        this.decidedAt = Instant.now();
        this.status = BatchStatus.DECIDED;
    }

    BatchSummary summarize() {
        List<BatchSummary.ProposalSummary> summaries = new ArrayList<>();
        for (Proposal proposal : proposals.values()) {
            summaries.add(BatchSummary.ProposalSummary.of(proposal));
        }
        return new BatchSummary(id, kind, context, summaries, forcedByDeadline);
    }

    BatchView view() {
        List<BatchView.ProposalView> views = new ArrayList<>();
        for (Proposal proposal : proposals.values()) {
            views.add(BatchView.ProposalView.of(proposal));
        }
        return new BatchView(id, requestId, kind, status, views, decision, createdAt, decidedAt,
            forcedByDeadline, cancellationReason);
    }

    public String getId() {
        return id;
    }

    public String getRequestId() {
        return requestId;
    }

    public ProposalKind getKind() {
        return kind;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public QuorumRule getQuorumRule() {
        return quorumRule;
    }

    public Duration getCollectionTimeout() {
        return collectionTimeout;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Map<String, Proposal> getProposals() {
        return Collections.unmodifiableMap(proposals);
    }

    public BatchStatus getStatus() {
        return status;
    }

    public Decision getDecision() {
        return decision;
    }

    public Instant getDecidedAt() {
        return decidedAt;
    }

    public boolean isForcedByDeadline() {
        return forcedByDeadline;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }
}

package com.proposalbus.proposal;

import com.proposalbus.bus.BusEvent;
import com.proposalbus.bus.EventBusService;
import com.proposalbus.bus.HandlerResult;
import com.proposalbus.bus.SubscriptionOptions;
import com.proposalbus.contract.EventPayload;
import com.proposalbus.contract.EventTypes;
import com.proposalbus.contract.ProposalDraft;
import com.proposalbus.contract.ProposalKind;
import com.proposalbus.contract.ProposalValidator;
import com.proposalbus.contract.ValidationFailedException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every proposal batch from creation to decision or cancellation.
 *
 * <p>State changes happen under this object's monitor; bus events are published after the
 * monitor is released. Finished batches move into a bounded history, oldest evicted first.
 */
@Service
public class BatchManager {

    private static final Logger log = LoggerFactory.getLogger(BatchManager.class);

    public static final String REASON_NO_PROPOSALS = "no-proposals";

    private final EventBusService bus;
    private final ProposalValidator validator;
    private final BatchProperties properties;
    private final Scheduler loop;
    private final BatchMetrics metrics = new BatchMetrics();

    private final Map<String, ProposalBatch> active = new LinkedHashMap<>();
    private final Deque<ProposalBatch> history = new ArrayDeque<>();
    private final Map<String, Disposable> deadlines = new HashMap<>();
    private Disposable proposalSubscription;

    public BatchManager(EventBusService bus, ProposalValidator validator, BatchProperties properties, Scheduler loop) {
        this.bus = bus;
        this.validator = validator;
        this.properties = properties;
        this.loop = loop;
    }

    @PostConstruct
    public void subscribe() {
        // proposals are never retried: a rejected one stays rejected
        proposalSubscription = bus.subscribe(EventTypes.AGENT_PROPOSAL, this::onProposalEvent,
            SubscriptionOptions.defaults().withRetries(0));
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (proposalSubscription != null) {
            proposalSubscription.dispose();
        }
        deadlines.values().forEach(Disposable::dispose);
        deadlines.clear();
    }

    public BatchView createBatch(String requestId, ProposalKind kind, Map<String, Object> context) {
        return createBatch(requestId, kind, context, BatchOptions.defaults());
    }

    /**
     * Registers a new batch in {@link BatchStatus#COLLECTING} and starts its collection deadline.
     *
     * @return a snapshot of the batch as registered
     * @throws IllegalArgumentException if the kind is missing or the timeout is not positive
     */
    public BatchView createBatch(String requestId, ProposalKind kind, Map<String, Object> context,
                                 BatchOptions options) {
        if (kind == null) {
            throw new IllegalArgumentException("proposal kind is required");
        }
        QuorumRule quorum = options.quorumRule() != null
            ? options.quorumRule()
            : QuorumRule.minimumCount(properties.getQuorumMinimum());
        Duration timeout = options.collectionTimeout() != null
            ? options.collectionTimeout()
            : properties.getCollectionTimeout();
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("collection timeout must be positive, got " + timeout.toMillis() + "ms");
        }

        ProposalBatch batch = new ProposalBatch(requestId, kind, context, quorum, timeout);
        BatchView registered;
        synchronized (this) {
            active.put(batch.getId(), batch);
            registered = batch.view();
        }
        if (options.onRegistered() != null) {
            options.onRegistered().accept(registered);
        }
        synchronized (this) {
            deadlines.put(batch.getId(), Mono.delay(timeout, loop)
                .subscribe(tick -> onDeadline(batch.getId()),
                    ex -> log.error("Deadline timer for batch {} failed", batch.getId(), ex)));
        }
        metrics.batchCreated();
        log.info("Created batch {} kind={} quorum={} timeout={}ms",
            batch.getId(), kind.getValue(), quorum, timeout.toMillis());
        bus.publish(EventTypes.BATCH_CREATED,
            new EventPayload.BatchCreated(batch.getId(), kind, batch.getContext()));
        return registered;
    }

    /**
     * Adds or replaces the submitting agent's proposal. Reaching quorum hands the batch to judging.
     *
     * @throws UnknownBatchException if no active batch has this id
     * @throws BatchNotCollectingException if the batch no longer collects
     * @throws ValidationFailedException if the proposal misses kind-specific fields
     */
    public Proposal addProposal(String batchId, ProposalDraft draft) {
        Proposal proposal;
        Proposal replaced;
        boolean quorumMet;
        synchronized (this) {
            ProposalBatch batch = requireKnown(batchId);
            if (batch.getStatus() != BatchStatus.COLLECTING) {
                throw new BatchNotCollectingException(batchId, batch.getStatus());
            }
            validator.validate(draft);
            proposal = Proposal.fromDraft(draft);
            replaced = batch.putProposal(proposal);
            quorumMet = batch.isQuorumMet();
            if (quorumMet) {
                batch.markReadyForJudging(false);
                cancelDeadline(batchId);
            }
        }
        if (replaced != null) {
            log.info("Agent {} replaced proposal {} with {} in batch {}",
                draft.agentId(), replaced.getId(), proposal.getId(), batchId);
        } else {
            log.info("Agent {} submitted proposal {} to batch {}", draft.agentId(), proposal.getId(), batchId);
        }
        bus.publish(EventTypes.PROPOSAL_ADDED, new EventPayload.ProposalAdded(
            batchId, proposal.getId(), proposal.getAgentId(), replaced == null ? null : replaced.getId()));
        if (quorumMet) {
            log.info("Batch {} reached quorum", batchId);
            dispatchToJudging(batchId);
        }
        return proposal;
    }

    /**
     * Attaches the decision, settles every proposal's status and retires the batch.
     *
     * @throws BatchNotJudgeableException unless the batch is ready for or in judging
     * @throws IllegalArgumentException if the winner has no proposal in the batch
     */
    public BatchView setDecision(String batchId, Decision decision) {
        ProposalBatch batch;
        synchronized (this) {
            batch = active.get(batchId);
            if (batch == null) {
                ProposalBatch retired = findRetired(batchId)
                    .orElseThrow(() -> new UnknownBatchException(batchId));
                throw new BatchNotJudgeableException(batchId, retired.getStatus());
            }
            if (!batch.getStatus().acceptsDecision()) {
                throw new BatchNotJudgeableException(batchId, batch.getStatus());
            }
            if (!batch.getProposals().containsKey(decision.winningAgentId())) {
                throw new IllegalArgumentException("winner " + decision.winningAgentId()
                    + " has no proposal in batch " + batchId);
            }
            batch.decide(decision);
            cancelDeadline(batchId);
            retire(batch);
        }
        long decisionMillis = Duration.between(batch.getCreatedAt(), batch.getDecidedAt()).toMillis();
        long textSize = batch.getProposals().values().stream()
            .mapToLong(p -> p.getMetadata().estimatedTextSize())
            .sum();
        metrics.batchCompleted(decisionMillis, textSize);

        Proposal winner = batch.getProposals().get(decision.winningAgentId());
        log.info("Batch {} decided: winner={} method={} confidence={} ({}ms)", batchId,
            decision.winningAgentId(), decision.method().getValue(), decision.confidence().getValue(), decisionMillis);
        bus.publish(EventTypes.PROPOSAL_DECISION_MADE,
            new EventPayload.BatchDecided(batchId, decision, winner.getId()));
        return batch.view();
    }

    public synchronized BatchView getBatch(String batchId) {
        ProposalBatch batch = active.get(batchId);
        if (batch != null) {
            return batch.view();
        }
        return findRetired(batchId)
            .map(ProposalBatch::view)
            .orElseThrow(() -> new UnknownBatchException(batchId));
    }

    public synchronized List<BatchView> activeBatches() {
        return active.values().stream().map(ProposalBatch::view).toList();
    }

    public synchronized List<BatchView> history() {
        return history.stream().map(ProposalBatch::view).toList();
    }

    public BatchMetrics.Snapshot metrics() {
        return metrics.snapshot();
    }

    void onDeadline(String batchId) {
        boolean cancelled;
        synchronized (this) {
            deadlines.remove(batchId);
            ProposalBatch batch = active.get(batchId);
            if (batch == null || batch.getStatus() != BatchStatus.COLLECTING) {
                return;
            }
            cancelled = batch.getProposals().isEmpty();
            if (cancelled) {
                batch.cancel(REASON_NO_PROPOSALS);
                retire(batch);
            } else {
                batch.markReadyForJudging(true);
                log.warn("Batch {} deadline elapsed with {} proposal(s) and quorum unmet; forcing judging",
                    batchId, batch.getProposals().size());
            }
        }
        if (cancelled) {
            metrics.batchCancelled();
            log.info("Batch {} cancelled: {}", batchId, REASON_NO_PROPOSALS);
            bus.publish(EventTypes.BATCH_CANCELLED, new EventPayload.BatchCancelled(batchId, REASON_NO_PROPOSALS));
        } else {
            metrics.forcedAdvance();
            dispatchToJudging(batchId);
        }
    }

    private void dispatchToJudging(String batchId) {
        BatchSummary summary;
        synchronized (this) {
            ProposalBatch batch = active.get(batchId);
            if (batch == null || batch.getStatus() != BatchStatus.READY_FOR_JUDGING) {
                return;
            }
            batch.markJudging();
            summary = batch.summarize();
        }
        log.info("Batch {} dispatched to judging with {} proposal(s)", batchId, summary.proposals().size());
        bus.publish(EventTypes.JUDGE_EVALUATE_BATCH, new EventPayload.EvaluateBatch(batchId, summary));
    }

    private Mono<HandlerResult> onProposalEvent(BusEvent event) {
        EventPayload.ProposalSubmitted submitted = event.payloadAs(EventPayload.ProposalSubmitted.class);
        String agentId = submitted.proposal() == null ? null : submitted.proposal().agentId();
        try {
            Proposal proposal = addProposal(submitted.batchId(), submitted.proposal());
            return Mono.just(HandlerResult.proceed(proposal.getId()));
        } catch (ValidationFailedException ex) {
            log.warn("Rejected proposal from {} for batch {}: {}", agentId, submitted.batchId(), ex.getErrors());
            bus.publish(EventTypes.PROPOSAL_REJECTED,
                new EventPayload.ProposalRejected(submitted.batchId(), agentId, ex.getErrors()));
        } catch (UnknownBatchException | BatchNotCollectingException ex) {
            log.warn("Rejected proposal from {}: {}", agentId, ex.getMessage());
            bus.publish(EventTypes.PROPOSAL_REJECTED,
                new EventPayload.ProposalRejected(submitted.batchId(), agentId, List.of(ex.getMessage())));
        }
        return Mono.just(HandlerResult.proceed());
    }

    private ProposalBatch requireKnown(String batchId) {
        ProposalBatch batch = active.get(batchId);
        if (batch != null) {
            return batch;
        }
        return findRetired(batchId).orElseThrow(() -> new UnknownBatchException(batchId));
    }

    private Optional<ProposalBatch> findRetired(String batchId) {
        return history.stream().filter(b -> b.getId().equals(batchId)).findFirst();
    }

    private void retire(ProposalBatch batch) {
        active.remove(batch.getId());
        history.addLast(batch);
        while (history.size() > properties.getMaxHistory()) {
            ProposalBatch evicted = history.removeFirst();
            log.debug("Evicted batch {} from history", evicted.getId());
        }
    }

    private void cancelDeadline(String batchId) {
        Disposable timer = deadlines.remove(batchId);
        if (timer != null) {
            timer.dispose();
        }
    }
}

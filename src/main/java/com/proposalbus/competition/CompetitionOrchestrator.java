package com.proposalbus.competition;

import com.proposalbus.bus.BusEvent;
import com.proposalbus.bus.EventBusService;
import com.proposalbus.bus.HandlerResult;
import com.proposalbus.contract.EventPayload;
import com.proposalbus.contract.EventTypes;
import com.proposalbus.contract.ProposalKind;
import com.proposalbus.judge.JudgePanel;
import com.proposalbus.judge.PanelVerdict;
import com.proposalbus.proposal.BatchManager;
import com.proposalbus.proposal.BatchNotJudgeableException;
import com.proposalbus.proposal.BatchOptions;
import com.proposalbus.proposal.BatchSummary;
import com.proposalbus.proposal.BatchView;
import com.proposalbus.proposal.Decision;
import com.proposalbus.proposal.ProposalStatus;
import com.proposalbus.proposal.QuorumRule;
import com.proposalbus.proposal.UnknownBatchException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.random.RandomGenerator;

/**
 * Drives one competition per batch: start, judging, decision, completion.
 *
 * <p>Judging is launched off the {@code judge:evaluate_batch} handler so the bus handler
 * timeout never cuts a panel short and a slow panel is never re-run by the bus retry loop.
 * Every tracked competition ends with exactly one {@code competition:completed} event.
 */
@Service
public class CompetitionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CompetitionOrchestrator.class);

    private final EventBusService bus;
    private final BatchManager batches;
    private final JudgePanel panel;
    private final CompetitionProperties properties;
    private final Scheduler loop;
    private final RandomGenerator random;

    private final ConcurrentHashMap<String, Competition> active = new ConcurrentHashMap<>();
    private final List<Disposable> subscriptions = new ArrayList<>();
    private volatile CompetitionMode mode;

    public CompetitionOrchestrator(EventBusService bus,
                                   BatchManager batches,
                                   JudgePanel panel,
                                   CompetitionProperties properties,
                                   Scheduler loop,
                                   RandomGenerator random) {
        this.bus = bus;
        this.batches = batches;
        this.panel = panel;
        this.properties = properties;
        this.loop = loop;
        this.random = random;
        this.mode = properties.getMode();
    }

    @PostConstruct
    public void subscribe() {
        subscriptions.add(bus.subscribe(EventTypes.JUDGE_EVALUATE_BATCH, this::onEvaluateBatch));
        subscriptions.add(bus.subscribe(EventTypes.BATCH_CANCELLED, this::onBatchCancelled));
        subscriptions.add(bus.subscribe(EventTypes.AGENT_PROPOSAL_EXECUTED, this::onProposalExecuted));
        subscriptions.add(bus.subscribe(EventTypes.PLATFORM_SETTINGS_UPDATED, this::onSettingsUpdated));
    }

    @PreDestroy
    public void shutdown() {
        subscriptions.forEach(Disposable::dispose);
        active.values().forEach(Competition::stopWatching);
    }

    public String start(ProposalKind kind, Map<String, Object> context) {
        return start(kind, context, StartOptions.defaults());
    }

    /**
     * Opens a batch and announces it with {@code competition:start}.
     *
     * @return the batch id agents must answer to
     */
    public String start(ProposalKind kind, Map<String, Object> context, StartOptions options) {
        Duration timeout = options.timeout() != null ? options.timeout() : properties.getProposalTimeout();
        QuorumRule quorum = null;
        if (options.expectedAgents() != null && !options.expectedAgents().isEmpty()) {
            quorum = QuorumRule.expectedAgents(options.expectedAgents());
        } else if (options.quorumMinimum() != null) {
            quorum = QuorumRule.minimumCount(options.quorumMinimum());
        }

        String requestId = "req_" + UUID.randomUUID().toString().substring(0, 8);
        // tracked before the deadline is armed so an early cancellation still completes it
        BatchView batch = batches.createBatch(requestId, kind, context, new BatchOptions(quorum, timeout,
            registered -> active.put(registered.batchId(), new Competition(registered.batchId(), kind,
                registered.createdAt(), registered.createdAt().plus(timeout)))));
        Instant deadline = batch.createdAt().plus(timeout);

        log.info("Competition {} started: kind={} mode={} deadline={}", batch.batchId(), kind.getValue(),
            mode.getValue(), deadline);
        bus.publishAwaitable(EventTypes.COMPETITION_START,
            new EventPayload.CompetitionStarted(batch.batchId(), kind, Instant.now(), deadline));
        return batch.batchId();
    }

    public CompetitionMode getMode() {
        return mode;
    }

    public void setMode(CompetitionMode mode) {
        if (this.mode != mode) {
            log.info("Competition mode switched from {} to {}", this.mode.getValue(), mode.getValue());
            this.mode = mode;
        }
    }

    public CompetitionStatus getStatus() {
        List<CompetitionStatus.ActiveCompetition> entries = active.values().stream()
            .map(c -> new CompetitionStatus.ActiveCompetition(c.batchId, c.kind, c.phase, c.startedAt, c.deadline))
            .toList();
        return new CompetitionStatus(mode, entries);
    }

    private Mono<HandlerResult> onEvaluateBatch(BusEvent event) {
        EventPayload.EvaluateBatch request = event.payloadAs(EventPayload.EvaluateBatch.class);
        BatchSummary summary = request.summary();
        Competition competition = active.get(request.batchId());
        if (competition != null) {
            competition.phase = "judging";
        }
        if (summary.isEmpty()) {
            log.error("Batch {} reached judging without proposals", request.batchId());
            complete(request.batchId(), CompetitionResult.failed(null, BatchManager.REASON_NO_PROPOSALS));
            return Mono.just(HandlerResult.proceed());
        }

        CompetitionMode current = mode;
        Mono<Decision> decision = current == CompetitionMode.SIMPLIFIED
            ? Mono.fromCallable(() -> simplifiedDecision(summary))
            : panel.evaluateBatch(summary).map(PanelVerdict::decision);
        decision
            .onErrorResume(ex -> {
                log.error("Judging of batch {} failed; degrading", summary.batchId(), ex);
                return Mono.just(Decision.degraded(summary.batchId(), summary.proposals().get(0).agentId(),
                    "Judging failed; first submitted proposal selected", List.of("judging error: " + ex.getMessage())));
            })
            .publishOn(loop)
            .subscribe(
                d -> conclude(summary.batchId(), d),
                ex -> log.error("Concluding batch {} failed", summary.batchId(), ex));
        return Mono.just(HandlerResult.proceed());
    }

    private Decision simplifiedDecision(BatchSummary summary) {
        List<BatchSummary.ProposalSummary> proposals = summary.proposals();
        int winnerIndex = random.nextInt(proposals.size());

        double[] votes = new double[proposals.size()];
        double max = 0;
        for (int i = 0; i < votes.length; i++) {
            votes[i] = random.nextDouble();
            max = Math.max(max, votes[i]);
        }
        // the drawn winner always leads the illustrative tally
        votes[winnerIndex] = max + 0.5;
        double total = 0;
        for (double vote : votes) {
            total += vote;
        }
        Map<String, Double> breakdown = new LinkedHashMap<>();
        for (int i = 0; i < votes.length; i++) {
            breakdown.put(proposals.get(i).agentId(), Math.round(votes[i] / total * 1000) / 10.0);
        }

        String winner = proposals.get(winnerIndex).agentId();
        log.info("Simplified pick for batch {}: {} (non-authoritative)", summary.batchId(), winner);
        bus.publish(EventTypes.COMPETITION_VOTING_RESULT,
            new EventPayload.VotingResult(summary.batchId(), winner, breakdown));
        return Decision.simplified(summary.batchId(), winner, breakdown);
    }

    private void conclude(String batchId, Decision decision) {
        BatchView decided;
        try {
            decided = batches.setDecision(batchId, decision);
        } catch (BatchNotJudgeableException | UnknownBatchException | IllegalArgumentException ex) {
            log.error("Decision for batch {} rejected: {}", batchId, ex.getMessage());
            complete(batchId, CompetitionResult.failed(decision, ex.getMessage()));
            return;
        }

        Competition competition = active.get(batchId);
        if (competition == null) {
            return;
        }
        if (!properties.isAwaitExecution()) {
            complete(batchId, CompetitionResult.decided(decision));
            return;
        }
        String winningProposalId = decided.proposals().stream()
            .filter(p -> p.status() == ProposalStatus.SELECTED)
            .map(BatchView.ProposalView::proposalId)
            .findFirst()
            .orElseThrow();
        competition.awaitExecution(winningProposalId, decision, Mono.delay(properties.getExecutionTimeout(), loop)
            .subscribe(tick -> {
                log.warn("Winning proposal {} of batch {} was not executed within {}ms", winningProposalId,
                    batchId, properties.getExecutionTimeout().toMillis());
                complete(batchId, CompetitionResult.executionTimedOut(decision));
            }, ex -> log.error("Execution watch for batch {} failed", batchId, ex)));
    }

    private Mono<HandlerResult> onBatchCancelled(BusEvent event) {
        EventPayload.BatchCancelled cancelled = event.payloadAs(EventPayload.BatchCancelled.class);
        complete(cancelled.batchId(), CompetitionResult.failed(null, cancelled.reason()));
        return Mono.just(HandlerResult.proceed());
    }

    private Mono<HandlerResult> onProposalExecuted(BusEvent event) {
        EventPayload.ProposalExecuted executed = event.payloadAs(EventPayload.ProposalExecuted.class);
        active.values().stream()
            .filter(c -> executed.proposalId() != null && executed.proposalId().equals(c.awaitedProposalId))
            .findFirst()
            .ifPresent(c -> {
                c.stopWatching();
                complete(c.batchId, CompetitionResult.executed(c.decision, executed.details()));
            });
        return Mono.just(HandlerResult.proceed());
    }

    private Mono<HandlerResult> onSettingsUpdated(BusEvent event) {
        EventPayload.SettingsUpdated settings = event.payloadAs(EventPayload.SettingsUpdated.class);
        if (settings.judgePanel() != null) {
            setMode(settings.judgePanel() ? CompetitionMode.PANEL : CompetitionMode.SIMPLIFIED);
        }
        return Mono.just(HandlerResult.proceed());
    }

    private void complete(String batchId, CompetitionResult result) {
        Competition competition = active.remove(batchId);
        if (competition == null) {
            return;
        }
        competition.stopWatching();
        if (result.succeeded()) {
            log.info("Competition {} completed: winner={}", batchId, result.decision().winningAgentId());
        } else {
            log.warn("Competition {} completed without success: {}", batchId, result.error());
        }
        bus.publish(EventTypes.COMPETITION_COMPLETED,
            new EventPayload.CompetitionCompleted(batchId, result, Instant.now()));
    }

    private static final class Competition {

        private final String batchId;
        private final ProposalKind kind;
        private final Instant startedAt;
        private final Instant deadline;
        private volatile String phase = "collecting";
        private volatile String awaitedProposalId;
        private volatile Decision decision;
        private volatile Disposable executionWatch;

        private Competition(String batchId, ProposalKind kind, Instant startedAt, Instant deadline) {
            this.batchId = batchId;
            this.kind = kind;
            this.startedAt = startedAt;
            this.deadline = deadline;
        }

        private void awaitExecution(String proposalId, Decision decision, Disposable watch) {
            this.phase = "awaiting_execution";
            this.awaitedProposalId = proposalId;
            this.decision = decision;
            this.executionWatch = watch;
        }

        private void stopWatching() {
            Disposable watch = executionWatch;
            if (watch != null) {
                watch.dispose();
            }
        }
    }
}

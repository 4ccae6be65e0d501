package com.proposalbus.proposal;

import com.proposalbus.bus.BusEvent;
import com.proposalbus.bus.EventBusProperties;
import com.proposalbus.bus.EventBusService;
import com.proposalbus.bus.InMemoryEventJournal;
import com.proposalbus.bus.JournalEntry;
import com.proposalbus.contract.EventPayload;
import com.proposalbus.contract.EventTypes;
import com.proposalbus.contract.ProposalKind;
import com.proposalbus.contract.ProposalValidator;
import com.proposalbus.contract.ValidationFailedException;
import com.proposalbus.support.Proposals;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BatchManagerTest {

    private VirtualTimeScheduler clock;
    private EventBusService bus;
    private BatchManager manager;

    @BeforeEach
    void setUp() {
        clock = VirtualTimeScheduler.create();
        bus = new EventBusService(new EventBusProperties(), new InMemoryEventJournal(1000), clock);
        BatchProperties properties = new BatchProperties();
        properties.setCollectionTimeout(Duration.ofSeconds(10));
        properties.setQuorumMinimum(2);
        properties.setMaxHistory(2);
        manager = new BatchManager(bus, new ProposalValidator(), properties, clock);
        manager.subscribe();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        clock.dispose();
    }

    private BatchView newBatch(QuorumRule quorum) {
        return manager.createBatch("req-1", ProposalKind.ASSET_PLACEMENT, Map.of("scene", "harbor"),
            new BatchOptions(quorum, null));
    }

    private List<BusEvent> events(String type) {
        return bus.query(Optional.of(type), 100).stream().map(JournalEntry::event).toList();
    }

    @Nested
    @DisplayName("Collecting")
    class Collecting {

        @Test
        void createBatch_usesConfiguredDefaultsAndPublishesBatchCreated() {
            BatchView batch = manager.createBatch("req-1", ProposalKind.CAMERA_MOVE, Map.of());

            assertEquals(BatchStatus.COLLECTING, batch.status());
            assertEquals(1, events(EventTypes.BATCH_CREATED).size());
            assertEquals(1, manager.activeBatches().size());

            clock.advanceTimeBy(Duration.ofSeconds(10));
            assertEquals(BatchStatus.CANCELLED, manager.getBatch(batch.batchId()).status());
        }

        @Test
        void createBatch_returnsSnapshotDetachedFromLaterChanges() {
            BatchView batch = newBatch(null);
            manager.addProposal(batch.batchId(), Proposals.assetPlacement("a", 1, "x"));

            assertTrue(batch.proposals().isEmpty());
            assertEquals(1, manager.getBatch(batch.batchId()).proposals().size());
        }

        @Test
        void registrationHook_runsBeforeBatchCreatedIsPublished() {
            List<Integer> createdEventsSeenByHook = new ArrayList<>();
            BatchView batch = manager.createBatch("req-1", ProposalKind.ASSET_PLACEMENT, Map.of(),
                new BatchOptions(null, null, view -> createdEventsSeenByHook.add(events(EventTypes.BATCH_CREATED).size())));

            assertEquals(List.of(0), createdEventsSeenByHook);
            assertEquals(1, events(EventTypes.BATCH_CREATED).size());
            assertEquals(BatchStatus.COLLECTING, manager.getBatch(batch.batchId()).status());
        }

        @Test
        void nonPositiveTimeout_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> manager.createBatch("req-1",
                ProposalKind.ASSET_PLACEMENT, Map.of(), new BatchOptions(null, Duration.ZERO)));
            assertThrows(IllegalArgumentException.class, () -> manager.createBatch("req-1",
                ProposalKind.ASSET_PLACEMENT, Map.of(), new BatchOptions(null, Duration.ofMillis(-5))));
            assertTrue(manager.activeBatches().isEmpty());
            assertTrue(events(EventTypes.BATCH_CREATED).isEmpty());
        }

        @Test
        void secondSubmissionFromSameAgent_overwritesFirst() {
            BatchView batch = newBatch(QuorumRule.expectedAgents(Set.of("a", "b", "c")));

            Proposal first = manager.addProposal(batch.batchId(), Proposals.assetPlacement("a", 1, "first idea"));
            Proposal second = manager.addProposal(batch.batchId(), Proposals.assetPlacement("a", 2, "better idea"));

            BatchView view = manager.getBatch(batch.batchId());
            assertEquals(1, view.proposals().size());
            assertEquals(second.getId(), view.proposals().get(0).proposalId());
            assertEquals("better idea", view.proposals().get(0).rationale());
            EventPayload.ProposalAdded replaced = events(EventTypes.PROPOSAL_ADDED).get(1)
                .payloadAs(EventPayload.ProposalAdded.class);
            assertEquals(first.batchId(), replaced.replacedProposalId());
        }

        @Test
        void metadata_isDerivedFromKindAndRationale() {
            BatchView batch = newBatch(null);
            Proposal proposal = manager.addProposal(batch.batchId(), Proposals.assetPlacement("a", 1, "12345"));
            assertEquals(2, proposal.getMetadata().priorityClass());
            assertEquals(2, proposal.getMetadata().estimatedTextSize());
            assertTrue(proposal.getMetadata().comparableFields().containsKey("position"));
            assertFalse(proposal.getMetadata().comparableFields().containsKey("name"));
        }

        @Test
        void unknownBatch_isRejected() {
            assertThrows(UnknownBatchException.class,
                () -> manager.addProposal("batch_missing", Proposals.assetPlacement("a", 1, "x")));
        }

        @Test
        void invalidProposal_isRejectedWithErrors() {
            BatchView batch = newBatch(null);
            ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> manager.addProposal(batch.batchId(), Proposals.assetPlacement("a", -3, "x")));
            assertFalse(ex.getErrors().isEmpty());
            assertTrue(manager.getBatch(batch.batchId()).proposals().isEmpty());
        }

        @Test
        void invalidProposalFromBus_isAnsweredWithRejection() {
            BatchView batch = newBatch(null);
            bus.publish(EventTypes.AGENT_PROPOSAL,
                new EventPayload.ProposalSubmitted(batch.batchId(), Proposals.assetPlacement("a", -3, "x")));

            List<BusEvent> rejected = events(EventTypes.PROPOSAL_REJECTED);
            assertEquals(1, rejected.size());
            EventPayload.ProposalRejected payload = rejected.get(0).payloadAs(EventPayload.ProposalRejected.class);
            assertEquals("a", payload.agentId());
            assertFalse(payload.errors().isEmpty());
        }

        @Test
        void validProposalFromBus_isStored() {
            BatchView batch = newBatch(null);
            bus.publish(EventTypes.AGENT_PROPOSAL,
                new EventPayload.ProposalSubmitted(batch.batchId(), Proposals.assetPlacement("a", 1, "x")));
            assertEquals(1, manager.getBatch(batch.batchId()).proposals().size());
        }
    }

    @Nested
    @DisplayName("Quorum and deadline")
    class QuorumAndDeadline {

        @Test
        void quorumReached_dispatchesToJudging() {
            BatchView batch = newBatch(null);
            manager.addProposal(batch.batchId(), Proposals.assetPlacement("a", 1, "x"));
            assertTrue(events(EventTypes.JUDGE_EVALUATE_BATCH).isEmpty());

            manager.addProposal(batch.batchId(), Proposals.assetPlacement("b", 1, "y"));

            BatchView view = manager.getBatch(batch.batchId());
            assertEquals(BatchStatus.JUDGING, view.status());
            assertFalse(view.forcedByDeadline());
            EventPayload.EvaluateBatch request = events(EventTypes.JUDGE_EVALUATE_BATCH).get(0)
                .payloadAs(EventPayload.EvaluateBatch.class);
            assertEquals(2, request.summary().proposals().size());
        }

        @Test
        void expectedAgents_waitForEveryone() {
            BatchView batch = newBatch(QuorumRule.expectedAgents(Set.of("a", "b", "c")));
            manager.addProposal(batch.batchId(), Proposals.assetPlacement("a", 1, "x"));
            manager.addProposal(batch.batchId(), Proposals.assetPlacement("b", 1, "y"));
            assertEquals(BatchStatus.COLLECTING, manager.getBatch(batch.batchId()).status());

            manager.addProposal(batch.batchId(), Proposals.assetPlacement("c", 1, "z"));
            assertEquals(BatchStatus.JUDGING, manager.getBatch(batch.batchId()).status());
        }

        @Test
        void deadlineWithZeroProposals_cancelsBatch() {
            BatchView batch = newBatch(null);

            clock.advanceTimeBy(Duration.ofSeconds(10));

            BatchView view = manager.getBatch(batch.batchId());
            assertEquals(BatchStatus.CANCELLED, view.status());
            assertEquals(BatchManager.REASON_NO_PROPOSALS, view.cancellationReason());
            EventPayload.BatchCancelled cancelled = events(EventTypes.BATCH_CANCELLED).get(0)
                .payloadAs(EventPayload.BatchCancelled.class);
            assertEquals(BatchManager.REASON_NO_PROPOSALS, cancelled.reason());
            assertEquals(1, manager.metrics().batchesCancelled());
        }

        @Test
        void deadlineWithOneProposal_forcesJudging() {
            BatchView batch = newBatch(null);
            manager.addProposal(batch.batchId(), Proposals.assetPlacement("a", 1, "x"));

            clock.advanceTimeBy(Duration.ofSeconds(9));
            assertEquals(BatchStatus.COLLECTING, manager.getBatch(batch.batchId()).status());
            clock.advanceTimeBy(Duration.ofSeconds(1));

            BatchView view = manager.getBatch(batch.batchId());
            assertNotEquals(BatchStatus.CANCELLED, view.status());
            assertEquals(BatchStatus.JUDGING, view.status());
            assertTrue(view.forcedByDeadline());
            assertEquals(1, events(EventTypes.JUDGE_EVALUATE_BATCH).size());
        }

        @Test
        void lateProposal_isRejected() {
            BatchView batch = newBatch(null);
            manager.addProposal(batch.batchId(), Proposals.assetPlacement("a", 1, "x"));
            manager.addProposal(batch.batchId(), Proposals.assetPlacement("b", 1, "y"));

            assertThrows(BatchNotCollectingException.class,
                () -> manager.addProposal(batch.batchId(), Proposals.assetPlacement("c", 1, "z")));
        }
    }

    @Nested
    @DisplayName("Decisions")
    class Decisions {

        private BatchView judgingBatch() {
            BatchView batch = newBatch(null);
            manager.addProposal(batch.batchId(), Proposals.assetPlacement("a", 1, "x"));
            manager.addProposal(batch.batchId(), Proposals.assetPlacement("b", 1, "y"));
            return batch;
        }

        @Test
        void setDecision_partitionsProposalsIntoOneSelectedAndRestRejected() {
            BatchView batch = judgingBatch();

            BatchView view = manager.setDecision(batch.batchId(),
                Decision.panel(batch.batchId(), "b", "b is better", Confidence.HIGH, List.of()));

            assertEquals(BatchStatus.DECIDED, view.status());
            assertNotNull(view.decidedAt());
            assertEquals(1, view.proposals().stream().filter(p -> p.status() == ProposalStatus.SELECTED).count());
            assertEquals(1, view.proposals().stream().filter(p -> p.status() == ProposalStatus.REJECTED).count());
            assertEquals(ProposalStatus.SELECTED, view.proposals().stream()
                .filter(p -> p.agentId().equals("b")).findFirst().orElseThrow().status());
            assertEquals(1, events(EventTypes.PROPOSAL_DECISION_MADE).size());
            assertEquals(1, manager.history().size());
            assertTrue(manager.activeBatches().isEmpty());
        }

        @Test
        void secondDecision_isRejected() {
            BatchView batch = judgingBatch();
            manager.setDecision(batch.batchId(), Decision.panel(batch.batchId(), "a", "r", Confidence.LOW, List.of()));

            assertThrows(BatchNotJudgeableException.class, () -> manager.setDecision(batch.batchId(),
                Decision.panel(batch.batchId(), "b", "r", Confidence.LOW, List.of())));
            assertEquals(1, events(EventTypes.PROPOSAL_DECISION_MADE).size());
        }

        @Test
        void decisionWhileCollecting_isRejected() {
            BatchView batch = newBatch(null);
            manager.addProposal(batch.batchId(), Proposals.assetPlacement("a", 1, "x"));

            assertThrows(BatchNotJudgeableException.class, () -> manager.setDecision(batch.batchId(),
                Decision.panel(batch.batchId(), "a", "r", Confidence.LOW, List.of())));
        }

        @Test
        void decisionForAgentOutsideBatch_isRejected() {
            BatchView batch = judgingBatch();
            assertThrows(IllegalArgumentException.class, () -> manager.setDecision(batch.batchId(),
                Decision.panel(batch.batchId(), "stranger", "r", Confidence.LOW, List.of())));
            assertEquals(BatchStatus.JUDGING, manager.getBatch(batch.batchId()).status());
        }

        @Test
        void proposalAfterDecision_isNotCollected() {
            BatchView batch = judgingBatch();
            manager.setDecision(batch.batchId(), Decision.panel(batch.batchId(), "a", "r", Confidence.LOW, List.of()));
            assertThrows(BatchNotCollectingException.class,
                () -> manager.addProposal(batch.batchId(), Proposals.assetPlacement("c", 1, "z")));
        }

        @Test
        void history_evictsOldestBeyondCap() {
            BatchView first = newBatch(null);
            newBatch(null);
            newBatch(null);

            clock.advanceTimeBy(Duration.ofSeconds(10));

            assertEquals(2, manager.history().size());
            assertThrows(UnknownBatchException.class, () -> manager.getBatch(first.batchId()));
        }
    }
}

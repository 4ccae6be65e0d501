package com.proposalbus.judge;

import com.proposalbus.proposal.BatchSummary;
import com.proposalbus.proposal.Confidence;
import com.proposalbus.support.FixedRandom;
import com.proposalbus.support.Proposals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RubricEvaluationStrategyTest {

    private final RubricEvaluationStrategy strategy = new RubricEvaluationStrategy(FixedRandom.noNoise());

    @Nested
    @DisplayName("Technical")
    class Technical {

        @Test
        void groundedPlacementBeatsIncompleteOne() {
            BatchSummary summary = Proposals.batch("batch-1",
                Proposals.summary("a", Map.of("position", List.of(1.0, 2.0, 7.0), "element_type", "tree"), "solid"),
                Proposals.summary("b", Map.of("name", "floating thing"), "hmm"));

            Assessment assessment = strategy.assess(JudgeSpecialty.TECHNICAL, summary);

            assertEquals("a", assessment.winner());
            assertEquals(7.0, assessment.scores().get("a"), 1e-9);
            assertEquals(-1.0, assessment.scores().get("b"), 1e-9);
            assertEquals(Confidence.HIGH, assessment.confidence());
            assertEquals(List.of("1 weak proposals"), assessment.concerns());
            assertEquals("technical evaluation: a scored 7.0 across 2 proposal(s)", assessment.rationale());
            assertEquals(EvaluationSource.RUBRIC, assessment.source());
        }

        @Test
        void placementBelowGroundWithoutTypeLoses() {
            BatchSummary summary = Proposals.batch("batch-1",
                Proposals.summary("a", Map.of("position", List.of(0.0, 0.0, 2.0), "element_type", "lamp"), ""),
                Proposals.summary("b", Map.of("position", List.of(0.0, 0.0, -1.0)), ""));

            Assessment assessment = strategy.assess(JudgeSpecialty.TECHNICAL, summary);

            assertEquals("a", assessment.winner());
            assertEquals(2.0, assessment.scores().get("b"), 1e-9);
            assertEquals(Confidence.HIGH, assessment.confidence());
        }

        @Test
        void belowGroundPositionIsPenalised() {
            BatchSummary.ProposalSummary sunken = Proposals.summary("a",
                Map.of("position", List.of(0.0, 0.0, -2.0), "element_type", "rock"), "");
            assertEquals(4.0, RubricEvaluationStrategy.score(JudgeSpecialty.TECHNICAL, sunken), 1e-9);
        }
    }

    @Test
    void storyRewardsBeatChoicesAndNarrativeWording() {
        BatchSummary.ProposalSummary proposal = Proposals.summary("a",
            Map.of("story_beat", "reveal", "choices", List.of("run", "hide")), "Moves the narrative forward");
        assertEquals(6.0, RubricEvaluationStrategy.score(JudgeSpecialty.STORY, proposal), 1e-9);
    }

    @Test
    void audienceRewardsEngagementAndLongRationales() {
        String rationale = "Maximises audience engagement with a cliffhanger that viewers will vote on";
        BatchSummary.ProposalSummary proposal = Proposals.summary("a", Map.of("choices", List.of("x")), rationale);
        assertEquals(6.0, RubricEvaluationStrategy.score(JudgeSpecialty.AUDIENCE, proposal), 1e-9);
    }

    @Test
    void visualRewardsFramingStylingAndWording() {
        BatchSummary.ProposalSummary proposal = Proposals.summary("a",
            Map.of("target_position", List.of(1, 2, 3), "color", "amber"), "A dramatic low angle");
        assertEquals(6.0, RubricEvaluationStrategy.score(JudgeSpecialty.VISUAL, proposal), 1e-9);
    }

    @Test
    void exactTieKeepsEarlierProposalWithLowConfidence() {
        Map<String, Object> payload = Map.of("position", List.of(1.0, 1.0, 1.0), "element_type", "cube");
        BatchSummary summary = Proposals.batch("batch-1",
            Proposals.summary("first", payload, "x"),
            Proposals.summary("second", payload, "x"));

        Assessment assessment = strategy.assess(JudgeSpecialty.TECHNICAL, summary);

        assertEquals("first", assessment.winner());
        assertEquals(Confidence.LOW, assessment.confidence());
        assertTrue(assessment.concerns().isEmpty());
    }

    @Test
    void emptyBatchFails() {
        StepVerifier.create(strategy.evaluate(JudgeSpecialty.STORY, Proposals.batch("batch-1")))
            .expectError(EvaluatorFailedException.class)
            .verify();
    }
}

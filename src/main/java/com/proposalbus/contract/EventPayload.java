package com.proposalbus.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalbus.competition.CompetitionResult;
import com.proposalbus.judge.Evaluation;
import com.proposalbus.proposal.BatchSummary;
import com.proposalbus.proposal.Decision;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Payloads carried by bus events, one record per event type (see {@link EventTypes}).
 */
public sealed interface EventPayload {

    /** {@code competition:start} */
    record CompetitionStarted(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("kind") ProposalKind kind,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("deadline") Instant deadline
    ) implements EventPayload {}

    /** {@code agent:proposal} */
    record ProposalSubmitted(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("proposal") ProposalDraft proposal
    ) implements EventPayload {}

    /** {@code proposal:batch_created} */
    record BatchCreated(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("kind") ProposalKind kind,
        @JsonProperty("context") Map<String, Object> context
    ) implements EventPayload {}

    /** {@code proposal:proposal_added} */
    record ProposalAdded(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("proposal_id") String proposalId,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("replaced_proposal_id") String replacedProposalId
    ) implements EventPayload {}

    /** {@code proposal:rejected} */
    record ProposalRejected(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("errors") List<String> errors
    ) implements EventPayload {}

    /** {@code judge:evaluate_batch} */
    record EvaluateBatch(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("summary") BatchSummary summary
    ) implements EventPayload {}

    /** {@code judge:decision_made} */
    record PanelDecided(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("decision") Decision decision,
        @JsonProperty("evaluations") List<Evaluation> evaluations,
        @JsonProperty("evaluation_time_ms") long evaluationTimeMs
    ) implements EventPayload {}

    /** {@code proposal:decision_made} */
    record BatchDecided(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("decision") Decision decision,
        @JsonProperty("winning_proposal_id") String winningProposalId
    ) implements EventPayload {}

    /** {@code proposal:batch_cancelled} */
    record BatchCancelled(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("reason") String reason
    ) implements EventPayload {}

    /** {@code competition:voting_result} */
    record VotingResult(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("winning_agent_id") String winningAgentId,
        @JsonProperty("vote_breakdown") Map<String, Double> voteBreakdown
    ) implements EventPayload {}

    /** {@code competition:completed} */
    record CompetitionCompleted(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("result") CompetitionResult result,
        @JsonProperty("timestamp") Instant timestamp
    ) implements EventPayload {}

    /** {@code agent:proposal_executed} */
    record ProposalExecuted(
        @JsonProperty("proposal_id") String proposalId,
        @JsonProperty("details") Map<String, Object> details
    ) implements EventPayload {}

    /** {@code platform:settings_updated} */
    record SettingsUpdated(
        @JsonProperty("judge_panel") Boolean judgePanel
    ) implements EventPayload {}
}

package com.proposalbus.contract;

/**
 * Event type names used on the bus.
 */
public final class EventTypes {

    public static final String COMPETITION_START = "competition:start";
    public static final String COMPETITION_COMPLETED = "competition:completed";
    public static final String COMPETITION_VOTING_RESULT = "competition:voting_result";

    public static final String AGENT_PROPOSAL = "agent:proposal";
    public static final String AGENT_PROPOSAL_EXECUTED = "agent:proposal_executed";

    public static final String BATCH_CREATED = "proposal:batch_created";
    public static final String PROPOSAL_ADDED = "proposal:proposal_added";
    public static final String PROPOSAL_REJECTED = "proposal:rejected";
    public static final String BATCH_CANCELLED = "proposal:batch_cancelled";
    public static final String PROPOSAL_DECISION_MADE = "proposal:decision_made";

    public static final String JUDGE_EVALUATE_BATCH = "judge:evaluate_batch";
    public static final String JUDGE_DECISION_MADE = "judge:decision_made";

    public static final String PLATFORM_SETTINGS_UPDATED = "platform:settings_updated";

    private EventTypes() {
    }
}

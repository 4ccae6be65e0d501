package com.proposalbus.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A proposal as submitted by an agent, before the batch assigns it an id and status.
 */
public record ProposalDraft(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("agent_category") AgentCategory agentCategory,
    @JsonProperty("kind") ProposalKind kind,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("rationale") String rationale
) {

    public ProposalDraft {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        rationale = rationale == null ? "" : rationale;
    }
}

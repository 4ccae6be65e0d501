package com.proposalbus.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalbus.contract.ProposalKind;

import java.util.Map;
import java.util.Set;

public record StartCompetitionRequest(
    @JsonProperty("kind") ProposalKind kind,
    @JsonProperty("context") Map<String, Object> context,
    @JsonProperty("expected_agents") Set<String> expectedAgents,
    @JsonProperty("quorum_minimum") Integer quorumMinimum,
    @JsonProperty("timeout_ms") Long timeoutMs
) {}

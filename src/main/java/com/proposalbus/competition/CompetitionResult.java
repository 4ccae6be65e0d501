package com.proposalbus.competition;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalbus.proposal.Decision;

import java.util.Map;

/**
 * Final outcome reported with {@code competition:completed}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompetitionResult(
    @JsonProperty("decision") Decision decision,
    @JsonProperty("error") String error,
    @JsonProperty("executed") Boolean executed,
    @JsonProperty("execution_details") Map<String, Object> executionDetails
) {

    public static final String EXECUTION_TIMEOUT = "execution-timeout";

    public static CompetitionResult decided(Decision decision) {
        return new CompetitionResult(decision, null, null, null);
    }

    public static CompetitionResult failed(Decision decision, String error) {
        return new CompetitionResult(decision, error, null, null);
    }

    public static CompetitionResult executed(Decision decision, Map<String, Object> details) {
        return new CompetitionResult(decision, null, true, details);
    }

    public static CompetitionResult executionTimedOut(Decision decision) {
        return new CompetitionResult(decision, EXECUTION_TIMEOUT, false, null);
    }

    public boolean succeeded() {
        return error == null && decision != null;
    }
}

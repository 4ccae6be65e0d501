package com.proposalbus.competition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalbus.contract.ProposalKind;

import java.time.Instant;
import java.util.List;

public record CompetitionStatus(
    @JsonProperty("mode") CompetitionMode mode,
    @JsonProperty("active") List<ActiveCompetition> active
) {

    public CompetitionStatus {
        active = List.copyOf(active);
    }

    public record ActiveCompetition(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("kind") ProposalKind kind,
        @JsonProperty("phase") String phase,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("deadline") Instant deadline
    ) {}
}

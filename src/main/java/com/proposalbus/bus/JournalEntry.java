package com.proposalbus.bus;

import com.fasterxml.jackson.annotation.JsonProperty;

public record JournalEntry(
    @JsonProperty("sequence_number") long sequenceNumber,
    @JsonProperty("event") BusEvent event
) {}

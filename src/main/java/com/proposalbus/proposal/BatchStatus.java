package com.proposalbus.proposal;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BatchStatus {
    COLLECTING("collecting"),
    READY_FOR_JUDGING("ready_for_judging"),
    JUDGING("judging"),
    DECIDED("decided"),
    CANCELLED("cancelled");

    private final String value;

    BatchStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean acceptsDecision() {
        return this == JUDGING || this == READY_FOR_JUDGING;
    }
}

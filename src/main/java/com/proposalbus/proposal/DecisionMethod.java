package com.proposalbus.proposal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a decision was reached. Only {@link #PANEL} and {@link #DEGRADED} decisions are
 * authoritative.
 */
public enum DecisionMethod {
    PANEL("panel"),
    DEGRADED("degraded"),
    SIMPLIFIED("simplified");

    private final String value;

    DecisionMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

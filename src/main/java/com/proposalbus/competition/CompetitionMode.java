package com.proposalbus.competition;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CompetitionMode {
    /** Weighted judge panel; authoritative. */
    PANEL("panel"),
    /** Uniform random pick with an illustrative vote breakdown; never authoritative. */
    SIMPLIFIED("simplified");

    private final String value;

    CompetitionMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

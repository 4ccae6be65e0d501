package com.proposalbus.proposal;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProposalStatus {
    PENDING("pending"),
    SELECTED("selected"),
    REJECTED("rejected");

    private final String value;

    ProposalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

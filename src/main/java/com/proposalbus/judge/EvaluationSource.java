package com.proposalbus.judge;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EvaluationSource {
    DELEGATED("delegated"),
    RUBRIC("rubric"),
    ABSTAINED("abstained");

    private final String value;

    EvaluationSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

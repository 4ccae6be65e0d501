package com.proposalbus.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * What a proposal wants to change. The priority class is fixed per kind; lower is more urgent.
 */
public enum ProposalKind {
    STORY_ADVANCE("story_advance", 1),
    ASSET_PLACEMENT("asset_placement", 2),
    CAMERA_MOVE("camera_move", 3),
    LIGHTING_CHANGE("lighting_change", 4),
    AUDIO_CUE("audio_cue", 5);

    private final String value;
    private final int priorityClass;

    ProposalKind(String value, int priorityClass) {
        this.value = value;
        this.priorityClass = priorityClass;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getPriorityClass() {
        return priorityClass;
    }

    @JsonCreator
    public static ProposalKind fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown proposal kind: " + raw));
    }
}

package com.proposalbus.proposal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Confidence {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3);

    private final String value;
    private final int score;

    Confidence(String value, int score) {
        this.value = value;
        this.score = score;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getScore() {
        return score;
    }

    /**
     * Maps a mean confidence score back onto the scale: {@code >= 2.5} high, {@code >= 1.5} medium.
     */
    public static Confidence fromMeanScore(double mean) {
        if (mean >= 2.5) {
            return HIGH;
        }
        if (mean >= 1.5) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Lenient parse for free-form backend answers; anything unrecognised is medium.
     */
    @JsonCreator
    public static Confidence fromValue(String raw) {
        if (raw == null) {
            return MEDIUM;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw.trim()))
            .findFirst()
            .orElse(MEDIUM);
    }
}

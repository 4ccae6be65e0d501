package com.proposalbus.judge;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * The lens a judge scores proposals through, with the criteria and system prompt sent to
 * the generative backend.
 */
public enum JudgeSpecialty {
    TECHNICAL("technical",
        List.of("collision_avoidance", "coordinate_correctness", "tool_usage", "performance_impact"),
        "You are a technical judge for a live 3D scene. Prefer proposals with valid coordinates, "
            + "no collisions and cheap execution."),
    STORY("story",
        List.of("story_advancement", "character_development", "genre_consistency", "tension_management"),
        "You are a story judge for an interactive narrative. Prefer proposals that move the story "
            + "forward and keep it coherent."),
    AUDIENCE("audience",
        List.of("viewer_interest", "choice_meaningfulness", "platform_suitability", "retention_potential"),
        "You are an audience judge for a live stream. Prefer proposals that keep viewers engaged "
            + "and give them meaningful choices."),
    VISUAL("visual",
        List.of("shot_composition", "visual_appeal", "camera_work", "scene_aesthetics"),
        "You are a visual judge for a live 3D scene. Prefer proposals with strong composition "
            + "and striking imagery.");

    private final String value;
    private final List<String> criteria;
    private final String systemPrompt;

    JudgeSpecialty(String value, List<String> criteria, String systemPrompt) {
        this.value = value;
        this.criteria = criteria;
        this.systemPrompt = systemPrompt;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public List<String> getCriteria() {
        return criteria;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    @JsonCreator
    public static JudgeSpecialty fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown judge specialty: " + raw));
    }
}

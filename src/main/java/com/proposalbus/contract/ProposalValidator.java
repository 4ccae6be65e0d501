package com.proposalbus.contract;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Kind-specific required-field checks applied before a proposal enters a batch.
 * All problems are collected so the submitter sees them at once.
 */
@Component
public class ProposalValidator {

    public void validate(ProposalDraft draft) {
        List<String> errors = check(draft);
        if (!errors.isEmpty()) {
            throw new ValidationFailedException(errors);
        }
    }

    public List<String> check(ProposalDraft draft) {
        List<String> errors = new ArrayList<>();
        if (draft == null) {
            errors.add("proposal is required");
            return errors;
        }
        requireString(draft.agentId(), "agent_id is required", errors);
        if (draft.agentCategory() == null) {
            errors.add("agent_category is required");
        }
        if (draft.kind() == null) {
            errors.add("kind is required");
            return errors;
        }

        Map<String, Object> payload = draft.payload();
        switch (draft.kind()) {
            case ASSET_PLACEMENT -> {
                List<?> position = requireVector(payload.get("position"), "payload.position", errors);
                if (position != null && ((Number) position.get(2)).doubleValue() < 0) {
                    errors.add("payload.position vertical coordinate must be >= 0");
                }
                requireString(payload.get("element_type"), "payload.element_type is required", errors);
                requireString(payload.get("name"), "payload.name is required", errors);
            }
            case CAMERA_MOVE -> requireVector(payload.get("target_position"), "payload.target_position", errors);
            case STORY_ADVANCE -> {
                requireString(payload.get("story_beat"), "payload.story_beat is required", errors);
                if (!(payload.get("choices") instanceof List<?>)) {
                    errors.add("payload.choices must be an array");
                }
            }
            case LIGHTING_CHANGE, AUDIO_CUE -> {
                // no required payload fields
            }
        }
        return errors;
    }

    private List<?> requireVector(Object value, String field, List<String> errors) {
        if (!(value instanceof List<?> list) || list.size() != 3) {
            errors.add(field + " must be an array of 3 numbers");
            return null;
        }
        for (Object component : list) {
            if (!(component instanceof Number)) {
                errors.add(field + " must be an array of 3 numbers");
                return null;
            }
        }
        return list;
    }

    private void requireString(Object value, String message, List<String> errors) {
        if (!(value instanceof String text) || text.isBlank()) {
            errors.add(message);
        }
    }
}

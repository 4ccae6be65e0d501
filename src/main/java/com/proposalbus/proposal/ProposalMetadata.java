package com.proposalbus.proposal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalbus.contract.ProposalDraft;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values derived once from a submitted proposal.
 */
public record ProposalMetadata(
    @JsonProperty("estimated_text_size") int estimatedTextSize,
    @JsonProperty("priority_class") int priorityClass,
    @JsonProperty("comparable_fields") Map<String, Object> comparableFields
) {

    static final List<String> SPATIAL_FIELDS = List.of("position", "target_position", "bounds", "radius");

    public static ProposalMetadata derive(ProposalDraft draft) {
        Map<String, Object> comparable = new LinkedHashMap<>();
        for (String field : SPATIAL_FIELDS) {
            Object value = draft.payload().get(field);
            if (value != null) {
                comparable.put(field, value);
            }
        }
        // roughly four characters per token
        int textSize = (int) Math.ceil(draft.rationale().length() / 4.0);
        return new ProposalMetadata(textSize, draft.kind().getPriorityClass(), Collections.unmodifiableMap(comparable));
    }
}

package com.proposalbus.judge;

import com.proposalbus.proposal.BatchSummary;

import java.util.List;
import java.util.function.Function;

/**
 * Structured request for the generative backend. Payloads are pre-rendered and truncated.
 */
public record JudgeBackendRequest(
    JudgeSpecialty specialty,
    String systemPrompt,
    List<String> criteria,
    List<Candidate> proposals
) {

    public JudgeBackendRequest {
        criteria = List.copyOf(criteria);
        proposals = List.copyOf(proposals);
    }

    public record Candidate(String agentId, String rationale, String payloadPreview) {}

    public static JudgeBackendRequest of(JudgeSpecialty specialty, BatchSummary summary, int previewChars,
                                         Function<Object, String> renderer) {
        List<Candidate> candidates = summary.proposals().stream()
            .map(p -> new Candidate(p.agentId(), p.rationale(), truncate(renderer.apply(p.payload()), previewChars)))
            .toList();
        return new JudgeBackendRequest(specialty, specialty.getSystemPrompt(), specialty.getCriteria(), candidates);
    }

    public String userPrompt() {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Evaluate these proposals as the ").append(specialty.getValue()).append(" judge.\n");
        prompt.append("Criteria: ").append(String.join(", ", criteria)).append("\n\nProposals:\n");
        for (int i = 0; i < proposals.size(); i++) {
            Candidate candidate = proposals.get(i);
            prompt.append(i + 1).append(". agent=").append(candidate.agentId()).append('\n')
                .append("   reasoning: ").append(candidate.rationale()).append('\n')
                .append("   payload: ").append(candidate.payloadPreview()).append('\n');
        }
        prompt.append("\nRespond with a JSON object only: ")
            .append("{\"winner\": \"<agent id>\", \"reasoning\": \"...\", ")
            .append("\"confidence\": \"low|medium|high\", \"concerns\": [\"...\"]}");
        return prompt.toString();
    }

    static String truncate(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "...";
    }
}

package com.proposalbus.support;

import com.proposalbus.contract.AgentCategory;
import com.proposalbus.contract.ProposalDraft;
import com.proposalbus.contract.ProposalKind;
import com.proposalbus.proposal.BatchSummary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Proposals {

    private Proposals() {
    }

    public static ProposalDraft assetPlacement(String agentId, double vertical, String rationale) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("position", List.of(1.0, 2.0, vertical));
        payload.put("element_type", "cube");
        payload.put("name", "crate_" + agentId);
        return new ProposalDraft(agentId, AgentCategory.SCENE, ProposalKind.ASSET_PLACEMENT, payload, rationale);
    }

    public static BatchSummary.ProposalSummary summary(String agentId, Map<String, Object> payload, String rationale) {
        return new BatchSummary.ProposalSummary("prop-" + agentId, agentId, AgentCategory.SCENE,
            ProposalKind.ASSET_PLACEMENT, payload, rationale, ProposalKind.ASSET_PLACEMENT.getPriorityClass());
    }

    public static BatchSummary batch(String batchId, BatchSummary.ProposalSummary... proposals) {
        return new BatchSummary(batchId, ProposalKind.ASSET_PLACEMENT, Map.of(), List.of(proposals), false);
    }
}

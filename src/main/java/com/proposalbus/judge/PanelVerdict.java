package com.proposalbus.judge;

import com.proposalbus.proposal.Decision;

import java.util.List;

public record PanelVerdict(Decision decision, List<Evaluation> evaluations, long evaluationTimeMs) {

    public PanelVerdict {
        evaluations = List.copyOf(evaluations);
    }
}

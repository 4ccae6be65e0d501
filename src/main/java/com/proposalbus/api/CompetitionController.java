package com.proposalbus.api;

import com.proposalbus.competition.CompetitionOrchestrator;
import com.proposalbus.competition.CompetitionStatus;
import com.proposalbus.competition.StartOptions;
import com.proposalbus.contract.ProposalDraft;
import com.proposalbus.proposal.BatchManager;
import com.proposalbus.proposal.BatchView;
import com.proposalbus.proposal.Proposal;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/competitions")
public class CompetitionController {

    private final CompetitionOrchestrator orchestrator;
    private final BatchManager batchManager;

    public CompetitionController(CompetitionOrchestrator orchestrator, BatchManager batchManager) {
        this.orchestrator = orchestrator;
        this.batchManager = batchManager;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> start(@RequestBody StartCompetitionRequest request) {
        if (request.kind() == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (request.timeoutMs() != null && request.timeoutMs() <= 0) {
            throw new IllegalArgumentException("timeout_ms must be positive");
        }
        StartOptions options = new StartOptions(request.expectedAgents(), request.quorumMinimum(),
            request.timeoutMs() == null ? null : Duration.ofMillis(request.timeoutMs()));
        String batchId = orchestrator.start(request.kind(),
            request.context() == null ? Map.of() : request.context(), options);
        return Map.of("status", "started", "batch_id", batchId);
    }

    /**
     * Direct submission path; agents on the bus use {@code agent:proposal} instead.
     */
    @PostMapping("/{batchId}/proposals")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> submit(@PathVariable String batchId, @RequestBody ProposalDraft draft) {
        Proposal proposal = batchManager.addProposal(batchId, draft);
        return Map.of(
            "status", "accepted",
            "proposal_id", proposal.getId(),
            "priority_class", proposal.getMetadata().priorityClass()
        );
    }

    @GetMapping
    public CompetitionStatus status() {
        return orchestrator.getStatus();
    }

    @GetMapping("/{batchId}")
    public BatchView batch(@PathVariable String batchId) {
        return batchManager.getBatch(batchId);
    }

    @GetMapping("/history")
    public List<BatchView> history() {
        return batchManager.history();
    }
}

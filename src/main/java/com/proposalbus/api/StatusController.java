package com.proposalbus.api;

import com.proposalbus.bus.EventBusService;
import com.proposalbus.judge.JudgePanel;
import com.proposalbus.proposal.BatchManager;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/v1/metrics")
public class StatusController {

    private final EventBusService bus;
    private final BatchManager batchManager;
    private final JudgePanel judgePanel;

    public StatusController(EventBusService bus, BatchManager batchManager, JudgePanel judgePanel) {
        this.bus = bus;
        this.batchManager = batchManager;
        this.judgePanel = judgePanel;
    }

    @GetMapping
    public Map<String, Object> metrics() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("bus", bus.metrics());
        body.put("batches", batchManager.metrics());
        body.put("panel", judgePanel.stats());
        body.put("latest_sequence", bus.latestSequence());
        return body;
    }
}

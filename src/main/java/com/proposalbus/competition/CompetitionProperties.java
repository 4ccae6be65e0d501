package com.proposalbus.competition;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "proposalbus.competition")
public class CompetitionProperties {

    private CompetitionMode mode = CompetitionMode.PANEL;
    private Duration proposalTimeout = Duration.ofSeconds(30);
    private boolean awaitExecution = false;
    private Duration executionTimeout = Duration.ofSeconds(10);

    public CompetitionMode getMode() {
        return mode;
    }

    public void setMode(CompetitionMode mode) {
        this.mode = mode;
    }

    public Duration getProposalTimeout() {
        return proposalTimeout;
    }

    public void setProposalTimeout(Duration proposalTimeout) {
        this.proposalTimeout = proposalTimeout;
    }

    public boolean isAwaitExecution() {
        return awaitExecution;
    }

    public void setAwaitExecution(boolean awaitExecution) {
        this.awaitExecution = awaitExecution;
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public void setExecutionTimeout(Duration executionTimeout) {
        this.executionTimeout = executionTimeout;
    }
}

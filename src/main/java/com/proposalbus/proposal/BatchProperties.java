package com.proposalbus.proposal;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "proposalbus.batch")
public class BatchProperties {

    private Duration collectionTimeout = Duration.ofSeconds(10);
    private int quorumMinimum = 2;
    private int maxHistory = 100;

    public Duration getCollectionTimeout() {
        return collectionTimeout;
    }

    public void setCollectionTimeout(Duration collectionTimeout) {
        this.collectionTimeout = collectionTimeout;
    }

    public int getQuorumMinimum() {
        return quorumMinimum;
    }

    public void setQuorumMinimum(int quorumMinimum) {
        this.quorumMinimum = quorumMinimum;
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public void setMaxHistory(int maxHistory) {
        this.maxHistory = maxHistory;
    }
}

package com.proposalbus.bus;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "proposalbus.bus")
public class EventBusProperties {

    private Duration defaultTimeout = Duration.ofSeconds(5);
    private int defaultRetries = 3;
    private Duration retryDelay = Duration.ofSeconds(1);
    private int journalCapacity = 5000;

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public int getDefaultRetries() {
        return defaultRetries;
    }

    public void setDefaultRetries(int defaultRetries) {
        this.defaultRetries = defaultRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    public int getJournalCapacity() {
        return journalCapacity;
    }

    public void setJournalCapacity(int journalCapacity) {
        this.journalCapacity = journalCapacity;
    }
}

package com.proposalbus.judge;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "proposalbus.judge")
public class JudgeProperties {

    public enum Strategy {
        RUBRIC,
        DELEGATED
    }

    private Strategy strategy = Strategy.RUBRIC;
    private Duration callTimeout = Duration.ofSeconds(15);
    private int payloadPreviewChars = 200;
    private TieBreakPolicy tieBreak = TieBreakPolicy.FIRST_SEEN;
    private double consensusThreshold = 0.75;
    private double closeMargin = 0.5;
    private int rationaleMaxLength = 150;
    private List<JudgeDefinition> judges = new ArrayList<>(List.of(
        new JudgeDefinition("tech_judge", JudgeSpecialty.TECHNICAL, 1.2),
        new JudgeDefinition("story_judge", JudgeSpecialty.STORY, 1.0),
        new JudgeDefinition("audience_judge", JudgeSpecialty.AUDIENCE, 1.0),
        new JudgeDefinition("visual_judge", JudgeSpecialty.VISUAL, 0.8)
    ));
    private Backend backend = new Backend();

    public Strategy getStrategy() {
        return strategy;
    }

    public void setStrategy(Strategy strategy) {
        this.strategy = strategy;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public int getPayloadPreviewChars() {
        return payloadPreviewChars;
    }

    public void setPayloadPreviewChars(int payloadPreviewChars) {
        this.payloadPreviewChars = payloadPreviewChars;
    }

    public TieBreakPolicy getTieBreak() {
        return tieBreak;
    }

    public void setTieBreak(TieBreakPolicy tieBreak) {
        this.tieBreak = tieBreak;
    }

    public double getConsensusThreshold() {
        return consensusThreshold;
    }

    public void setConsensusThreshold(double consensusThreshold) {
        this.consensusThreshold = consensusThreshold;
    }

    public double getCloseMargin() {
        return closeMargin;
    }

    public void setCloseMargin(double closeMargin) {
        this.closeMargin = closeMargin;
    }

    public int getRationaleMaxLength() {
        return rationaleMaxLength;
    }

    public void setRationaleMaxLength(int rationaleMaxLength) {
        this.rationaleMaxLength = rationaleMaxLength;
    }

    public List<JudgeDefinition> getJudges() {
        return judges;
    }

    public void setJudges(List<JudgeDefinition> judges) {
        this.judges = judges;
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public static class JudgeDefinition {

        private String id;
        private JudgeSpecialty specialty;
        private double weight = 1.0;

        public JudgeDefinition() {
        }

        public JudgeDefinition(String id, JudgeSpecialty specialty, double weight) {
            this.id = id;
            this.specialty = specialty;
            this.weight = weight;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public JudgeSpecialty getSpecialty() {
            return specialty;
        }

        public void setSpecialty(JudgeSpecialty specialty) {
            this.specialty = specialty;
        }

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }
    }

    public static class Backend {

        private String baseUrl = "https://api.anthropic.com";
        private String apiKey = "";
        private String model = "claude-3-haiku-20240307";
        private int maxTokens = 500;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }
}

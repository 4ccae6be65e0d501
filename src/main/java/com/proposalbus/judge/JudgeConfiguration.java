package com.proposalbus.judge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proposalbus.bus.EventBusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.random.RandomGenerator;

@Configuration
public class JudgeConfiguration {

    private static final Logger log = LoggerFactory.getLogger(JudgeConfiguration.class);

    @Bean
    public RandomGenerator judgeRandom() {
        return RandomGenerator.getDefault();
    }

    @Bean
    public JudgeBackendClient judgeBackendClient(WebClient.Builder builder, JudgeProperties properties) {
        return new AnthropicJudgeBackendClient(builder, properties.getBackend());
    }

    @Bean
    public RubricEvaluationStrategy rubricEvaluationStrategy(RandomGenerator judgeRandom) {
        return new RubricEvaluationStrategy(judgeRandom);
    }

    /**
     * One judge per configured definition, all sharing the strategy selected by
     * {@code proposalbus.judge.strategy}.
     */
    @Bean
    public JudgePanel judgePanel(JudgeProperties properties,
                                 RubricEvaluationStrategy rubric,
                                 JudgeBackendClient backendClient,
                                 ObjectMapper objectMapper,
                                 Scheduler competitionLoop,
                                 EventBusService bus) {
        EvaluationStrategy strategy = switch (properties.getStrategy()) {
            case RUBRIC -> rubric;
            case DELEGATED -> new DelegatedEvaluationStrategy(backendClient, new JudgeResponseParser(objectMapper),
                rubric, objectMapper, properties.getCallTimeout(), properties.getPayloadPreviewChars(),
                competitionLoop);
        };
        List<Judge> judges = properties.getJudges().stream()
            .map(definition -> new Judge(definition.getId(), definition.getSpecialty(), definition.getWeight(), strategy))
            .toList();
        log.info("Judge panel: {} judge(s), strategy={}, tie-break={}", judges.size(),
            properties.getStrategy(), properties.getTieBreak());
        WeightedVoteAggregator aggregator = new WeightedVoteAggregator(properties.getTieBreak(),
            properties.getConsensusThreshold(), properties.getCloseMargin(), properties.getRationaleMaxLength());
        return new JudgePanel(judges, aggregator, bus);
    }
}

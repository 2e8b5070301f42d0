package com.herzen.dropout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.dropout.reasoning.BoundedReasoningAnalyzer;
import com.herzen.dropout.reasoning.HeuristicReasoningAnalyzer;
import com.herzen.dropout.reasoning.OpenAiReasoningAnalyzer;
import com.herzen.dropout.reasoning.ReasoningAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ReasoningConfig {
    private static final Logger log = LoggerFactory.getLogger(ReasoningConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HeuristicReasoningAnalyzer heuristicReasoningAnalyzer() {
        return new HeuristicReasoningAnalyzer();
    }

    @Bean
    @Primary
    public BoundedReasoningAnalyzer reasoningAnalyzer(DropoutProperties properties,
                                                      HeuristicReasoningAnalyzer heuristic,
                                                      RestTemplateBuilder restTemplateBuilder,
                                                      ObjectMapper objectMapper) {
        DropoutProperties.Reasoning reasoning = properties.getReasoning();
        ReasoningAnalyzer delegate = heuristic;
        if ("openai".equalsIgnoreCase(reasoning.getProvider())) {
            if (reasoning.getApiKey() == null || reasoning.getApiKey().isBlank()) {
                log.warn("dropout.reasoning.provider=openai without an api key; using heuristic analyzer");
            } else {
                Duration timeout = Duration.ofMillis(reasoning.getTimeoutMs());
                delegate = new OpenAiReasoningAnalyzer(
                        restTemplateBuilder.setConnectTimeout(timeout).setReadTimeout(timeout).build(),
                        objectMapper, reasoning.getBaseUrl(), reasoning.getApiKey(), reasoning.getModel());
            }
        }
        log.info("Reasoning analyzer: {} (timeout {} ms)", delegate.getClass().getSimpleName(), reasoning.getTimeoutMs());
        return new BoundedReasoningAnalyzer(delegate, heuristic, reasoning.getTimeoutMs(), reasoning.getThreads());
    }
}

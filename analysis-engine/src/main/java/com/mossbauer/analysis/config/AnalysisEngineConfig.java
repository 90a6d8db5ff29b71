package com.mossbauer.analysis.config;

import com.mossbauer.analysis.ai.AnthropicCompletionClient;
import com.mossbauer.common.fitting.OptimizerSettings;
import com.mossbauer.common.fitting.SpectrumFitter;
import com.mossbauer.common.fitting.SpectrumOptimizer;
import com.mossbauer.common.interpretation.InterpreterContext;
import com.mossbauer.common.interpretation.SpectrumInterpreter;
import com.mossbauer.common.interpretation.TextCompletionClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class AnalysisEngineConfig {

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${anthropic.model:claude-sonnet-4-6}")
    private String anthropicModel;

    @Value("${anthropic.timeout-ms:20000}")
    private long anthropicTimeoutMs;

    @Value("${anthropic.max-tokens:300}")
    private int anthropicMaxTokens;

    @Value("${anthropic.temperature:0.4}")
    private double anthropicTemperature;

    @Value("${fitting.max-iterations:2000}")
    private int maxIterations;

    @Value("${fitting.evaluations-per-variable:2000}")
    private int evaluationsPerVariable;

    @Value("${fitting.cost-tolerance:1e-10}")
    private double costTolerance;

    @Value("${fitting.parameter-tolerance:1e-10}")
    private double parameterTolerance;

    @Bean
    public SpectrumFitter spectrumFitter() {
        return new SpectrumFitter(new SpectrumOptimizer(
            new OptimizerSettings(maxIterations, evaluationsPerVariable, costTolerance, parameterTolerance)));
    }

    @Bean
    public TextCompletionClient textCompletionClient(WebClient.Builder builder, ObjectMapper objectMapper) {
        return new AnthropicCompletionClient(builder, objectMapper, anthropicBaseUrl, anthropicModel);
    }

    @Bean
    public SpectrumInterpreter spectrumInterpreter(TextCompletionClient textCompletionClient) {
        return new SpectrumInterpreter(new InterpreterContext(
            anthropicApiKey, textCompletionClient, anthropicMaxTokens, anthropicTemperature,
            Duration.ofMillis(anthropicTimeoutMs)));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}

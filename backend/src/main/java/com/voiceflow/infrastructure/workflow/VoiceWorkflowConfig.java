package com.voiceflow.infrastructure.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voiceflow.domain.workflow.model.CorrelationMethod;
import com.voiceflow.domain.workflow.model.CorrelationSettings;
import com.voiceflow.infrastructure.ai.LanguageModelClient;
import com.voiceflow.infrastructure.correlation.EventCorrelator;
import com.voiceflow.infrastructure.correlation.KeywordSimilarityScorer;
import com.voiceflow.infrastructure.intent.ConditionExtractor;
import com.voiceflow.infrastructure.intent.IntentAnalyzer;
import com.voiceflow.infrastructure.intent.LlmIntentEnhancer;
import com.voiceflow.infrastructure.intent.ParameterExtractor;
import com.voiceflow.infrastructure.intent.TranscriptNormalizer;
import com.voiceflow.infrastructure.intent.VariableExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class VoiceWorkflowConfig {

    @Value("${correlation.time-window:5.0}")
    private double timeWindow;

    @Value("${correlation.min-confidence:0.3}")
    private double minConfidence;

    @Value("${correlation.method:time_window}")
    private String correlationMethod;

    @Value("${intent.semantic-enhancement.enabled:false}")
    private boolean semanticEnhancementEnabled;

    @Value("${workflow.refinement.timeout:30s}")
    private Duration refinementTimeout;

    @Value("${workflow.refinement.threads:4}")
    private int refinementThreads;

    @Bean
    public CorrelationSettings correlationSettings() {
        CorrelationSettings settings = new CorrelationSettings(
                timeWindow, minConfidence, CorrelationMethod.fromValue(correlationMethod));
        log.info("[Config] Correlation: window={}s, minConfidence={}, method={}",
                settings.timeWindow(), settings.minConfidence(), settings.method().value());
        return settings;
    }

    @Bean
    public EventCorrelator eventCorrelator(CorrelationSettings correlationSettings,
                                           KeywordSimilarityScorer similarityScorer) {
        return new EventCorrelator(correlationSettings, similarityScorer);
    }

    @Bean
    public IntentAnalyzer intentAnalyzer(TranscriptNormalizer normalizer,
                                         VariableExtractor variableExtractor,
                                         ConditionExtractor conditionExtractor,
                                         ParameterExtractor parameterExtractor,
                                         LanguageModelClient languageModelClient,
                                         ObjectMapper objectMapper) {
        LlmIntentEnhancer enhancer = semanticEnhancementEnabled
                ? new LlmIntentEnhancer(languageModelClient, objectMapper)
                : null;
        log.info("[Config] Intent semantic enhancement: {}", semanticEnhancementEnabled ? "on" : "off");
        return new IntentAnalyzer(normalizer, variableExtractor, conditionExtractor, parameterExtractor, enhancer);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService stepRefinementExecutor() {
        if (refinementThreads < 1) {
            throw new IllegalArgumentException("workflow.refinement.threads must be at least 1: " + refinementThreads);
        }
        return Executors.newFixedThreadPool(refinementThreads);
    }

    @Bean
    public EnhancedWorkflowGenerator enhancedWorkflowGenerator(LanguageModelClient languageModelClient,
                                                               IntentAnalyzer intentAnalyzer,
                                                               ObjectMapper objectMapper,
                                                               ExecutorService stepRefinementExecutor) {
        log.info("[Config] Step refinement: {} threads, timeout={}", refinementThreads, refinementTimeout);
        return new EnhancedWorkflowGenerator(languageModelClient, intentAnalyzer, objectMapper,
                stepRefinementExecutor, refinementTimeout);
    }
}

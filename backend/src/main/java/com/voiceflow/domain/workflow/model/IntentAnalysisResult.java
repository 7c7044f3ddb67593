package com.voiceflow.domain.workflow.model;

import java.util.List;
import java.util.Map;

/**
 * Result of analyzing a single utterance.
 *
 * @param intentType         classified intent
 * @param confidence         classification confidence in [0, 1]
 * @param extractedVariables variable name → placeholder reference (e.g. "${username}")
 * @param conditions         normalized "if X then Y" clauses, in match order
 * @param parameters         intent-specific parameters (count, time_filter, value, select_all, deselect)
 * @param rawText            original utterance
 * @param processedText      normalized utterance the rules ran against
 */
public record IntentAnalysisResult(
        IntentType intentType,
        double confidence,
        Map<String, String> extractedVariables,
        List<String> conditions,
        Map<String, Object> parameters,
        String rawText,
        String processedText
) {}

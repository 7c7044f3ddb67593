package com.voiceflow.domain.workflow.model;

import java.util.List;
import java.util.Map;

/**
 * Refinement returned by a semantic intent enhancer. A null intent type keeps the rule-based one.
 */
public record SemanticIntent(
        IntentType intentType,
        double confidence,
        Map<String, String> variables,
        List<String> conditions,
        Map<String, Object> parameters
) {}

package com.voiceflow.domain.workflow.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of asking the language model to refine one workflow step.
 * Either a success carrying the structured reply, or a failure carrying the reason.
 */
public record StepRefinement(
        boolean success,
        String enhancedAction,
        List<String> conditions,
        Map<String, String> variables,
        String errorHandling,
        List<String> smartSelectors,
        String failureReason
) {
    public static StepRefinement success(String enhancedAction, List<String> conditions,
                                         Map<String, String> variables, String errorHandling,
                                         List<String> smartSelectors) {
        return new StepRefinement(true, enhancedAction, conditions, variables, errorHandling, smartSelectors, null);
    }

    public static StepRefinement failure(String reason) {
        return new StepRefinement(false, null, List.of(), Map.of(), null, List.of(), reason);
    }
}

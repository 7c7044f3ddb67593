package com.voiceflow.infrastructure.workflow;

import com.voiceflow.domain.workflow.model.EnhancedWorkflowStep;
import com.voiceflow.domain.workflow.model.IntentAnalysisResult;
import com.voiceflow.domain.workflow.model.VoiceContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enrichment without the language model: union of per-utterance variables
 * (later utterance wins on equal key), concatenated conditions, and a voice context
 * holding only the instructions and intent labels. Action is left as is.
 */
public class RuleBasedStepEnricher {

    public EnhancedWorkflowStep enrich(EnhancedWorkflowStep step, List<String> voiceTexts,
                                       List<IntentAnalysisResult> analyses) {
        Map<String, String> variables = new LinkedHashMap<>();
        List<String> conditions = new ArrayList<>();

        for (IntentAnalysisResult analysis : analyses) {
            variables.putAll(analysis.extractedVariables());
            conditions.addAll(analysis.conditions());
        }

        return step.toBuilder()
                .voiceContext(VoiceContext.ruleBased(List.copyOf(voiceTexts), intentLabels(analyses)))
                .extractedVariables(variables)
                .conditions(conditions)
                .enhanced(true)
                .build();
    }

    static List<String> intentLabels(List<IntentAnalysisResult> analyses) {
        return analyses.stream()
                .map(a -> a.intentType().label())
                .toList();
    }
}

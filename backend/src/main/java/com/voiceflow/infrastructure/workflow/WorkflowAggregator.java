package com.voiceflow.infrastructure.workflow;

import com.voiceflow.domain.workflow.model.EnhancedWorkflowStep;
import com.voiceflow.domain.workflow.model.WorkflowCondition;
import com.voiceflow.domain.workflow.model.WorkflowVariable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifts step-level variables and conditions to workflow level.
 */
public class WorkflowAggregator {

    /**
     * First step to declare a variable name wins; later declarations are ignored.
     */
    public Map<String, WorkflowVariable> collectVariables(List<EnhancedWorkflowStep> steps) {
        Map<String, WorkflowVariable> variables = new LinkedHashMap<>();
        for (EnhancedWorkflowStep step : steps) {
            if (step.getExtractedVariables() == null) {
                continue;
            }
            step.getExtractedVariables().forEach((name, placeholder) ->
                    variables.putIfAbsent(name, WorkflowVariable.fromVoice(placeholder)));
        }
        return variables;
    }

    public List<WorkflowCondition> collectConditions(List<EnhancedWorkflowStep> steps) {
        List<WorkflowCondition> conditions = new ArrayList<>();
        for (EnhancedWorkflowStep step : steps) {
            if (step.getConditions() == null) {
                continue;
            }
            for (String condition : step.getConditions()) {
                conditions.add(new WorkflowCondition(condition, step.getId(), WorkflowCondition.VOICE_EXTRACTED));
            }
        }
        return conditions;
    }
}

package com.voiceflow.domain.workflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Workflow-level parameter registered from a step's extracted variables.
 */
public record WorkflowVariable(
        String type,
        @JsonProperty("default") String defaultValue,
        String description
) {
    public static WorkflowVariable fromVoice(String placeholder) {
        return new WorkflowVariable("string", placeholder, "Extracted from voice: " + placeholder);
    }
}

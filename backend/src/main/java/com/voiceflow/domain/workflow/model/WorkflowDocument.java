package com.voiceflow.domain.workflow.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * Final voice-enhanced workflow definition.
 */
@JsonPropertyOrder({"name", "description", "version", "variables", "conditions", "steps", "metadata"})
public record WorkflowDocument(
        String name,
        String description,
        String version,
        Map<String, WorkflowVariable> variables,
        List<WorkflowCondition> conditions,
        List<EnhancedWorkflowStep> steps,
        WorkflowMetadata metadata
) {
    public static final String NAME = "Enhanced Voice Workflow";
    public static final String DEFAULT_DESCRIPTION = "Voice-enhanced browser automation workflow";
    public static final String VERSION = "1.0";
}

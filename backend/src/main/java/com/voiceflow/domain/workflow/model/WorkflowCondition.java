package com.voiceflow.domain.workflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkflowCondition(
        String condition,
        @JsonProperty("step_id") String stepId,
        String type
) {
    public static final String VOICE_EXTRACTED = "voice_extracted";
}

package com.voiceflow.domain.workflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkflowMetadata(
        boolean enhanced,
        @JsonProperty("voice_events_count") int voiceEventsCount,
        @JsonProperty("browser_events_count") int browserEventsCount
) {}

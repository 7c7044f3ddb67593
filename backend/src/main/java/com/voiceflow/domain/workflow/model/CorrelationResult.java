package com.voiceflow.domain.workflow.model;

import java.util.List;
import java.util.Map;

/**
 * Correlation of one browser event with the voice events spoken around it.
 * A score of 0.0 means "no usable voice context".
 */
public record CorrelationResult(
        BrowserEvent browserEvent,
        List<VoiceEvent> voiceEvents,
        double correlationScore,
        double timeWindow,
        CorrelationMethod correlationMethod,
        Map<String, Object> metadata
) {
    public boolean hasVoiceEvents() {
        return voiceEvents != null && !voiceEvents.isEmpty();
    }
}

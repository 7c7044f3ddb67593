package com.voiceflow.domain.workflow.model;

import java.util.Map;

/**
 * A transcribed utterance captured during a recording session.
 *
 * @param id          unique id within the session
 * @param text        raw utterance text
 * @param timestamp   seconds, monotonic within a session
 * @param confidence  transcription reliability in [0, 1]
 * @param sessionId   recording session the utterance belongs to
 * @param url         page URL at utterance time
 * @param intentType  optional pre-assigned intent label (nullable)
 * @param variables   optional pre-assigned variables (nullable)
 */
public record VoiceEvent(
        String id,
        String text,
        double timestamp,
        double confidence,
        String sessionId,
        String url,
        String intentType,
        Map<String, String> variables
) {
    public VoiceEvent(String id, String text, double timestamp, double confidence, String sessionId, String url) {
        this(id, text, timestamp, confidence, sessionId, url, null, null);
    }
}

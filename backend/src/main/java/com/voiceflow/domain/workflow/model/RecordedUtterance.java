package com.voiceflow.domain.workflow.model;

/**
 * Utterance as reported by the recorder extension.
 *
 * @param timestamp  seconds
 * @param confidence transcription confidence, null when the payload carries none
 */
public record RecordedUtterance(String text, double timestamp, String url, Double confidence) {

    public RecordedUtterance(String text, double timestamp, String url) {
        this(text, timestamp, url, null);
    }
}

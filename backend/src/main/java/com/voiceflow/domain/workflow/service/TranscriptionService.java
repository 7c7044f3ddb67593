package com.voiceflow.domain.workflow.service;

import com.voiceflow.domain.workflow.model.Transcription;

/**
 * Turns raw audio into text. Implementations must not throw into the pipeline:
 * any failure is reported as a null result.
 */
public interface TranscriptionService {

    /**
     * @param audio encoded audio bytes
     * @return transcription, or null when nothing usable was recognized
     */
    Transcription transcribe(byte[] audio);
}

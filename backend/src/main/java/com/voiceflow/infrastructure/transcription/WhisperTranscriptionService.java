package com.voiceflow.infrastructure.transcription;

import com.openai.client.OpenAIClient;
import com.openai.models.audio.transcriptions.TranscriptionCreateParams;
import com.voiceflow.domain.workflow.model.Transcription;
import com.voiceflow.domain.workflow.service.TranscriptionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Speech-to-text through the OpenAI audio transcription endpoint.
 * Clips shorter than {@link #MIN_AUDIO_BYTES} or larger than the API upload limit are rejected
 * without a call. The clip is uploaded under each of {@link #UPLOAD_EXTENSIONS} in turn until one
 * yields non-empty text. The endpoint reports no confidence, so a configured constant is attached.
 */
@Slf4j
@Service
public class WhisperTranscriptionService implements TranscriptionService {

    static final int MIN_AUDIO_BYTES = 8 * 1024;
    static final int MAX_AUDIO_BYTES = 25 * 1024 * 1024;

    /** Upload labels tried in order; browser recorders usually produce webm/opus. */
    static final List<String> UPLOAD_EXTENSIONS = List.of(".wav", ".mp3", ".m4a", ".ogg", ".webm");

    private final OpenAIClient openAIClient;
    private final String model;
    private final String language;
    private final double confidence;

    public WhisperTranscriptionService(OpenAIClient openAIClient,
                                       @Value("${transcription.model:whisper-1}") String model,
                                       @Value("${transcription.language:zh}") String language,
                                       @Value("${transcription.confidence:0.8}") double confidence) {
        this.openAIClient = openAIClient;
        this.model = model;
        this.language = language;
        this.confidence = confidence;
    }

    @Override
    public Transcription transcribe(byte[] audio) {
        if (audio == null || audio.length < MIN_AUDIO_BYTES) {
            log.warn("[Transcription] Audio too short ({} bytes < {})",
                    audio == null ? 0 : audio.length, MIN_AUDIO_BYTES);
            return null;
        }
        if (audio.length > MAX_AUDIO_BYTES) {
            log.warn("[Transcription] Audio too large ({} bytes), skipping", audio.length);
            return null;
        }

        for (String extension : UPLOAD_EXTENSIONS) {
            String text = transcribeAs(audio, extension);
            if (text != null) {
                log.info("[Transcription] Transcribed {} bytes as {} → {} chars",
                        audio.length, extension, text.length());
                return new Transcription(text, confidence);
            }
        }

        log.error("[Transcription] All upload formats failed for {} bytes", audio.length);
        return null;
    }

    /**
     * One upload attempt with the clip labelled by {@code extension}.
     * Returns the trimmed text, or null when the call fails or the text is empty.
     */
    private String transcribeAs(byte[] audio, String extension) {
        Path tempFile = null;
        try {
            tempFile = Files.createTempFile("utterance-", extension);
            Files.write(tempFile, audio);

            TranscriptionCreateParams.Builder params = TranscriptionCreateParams.builder()
                    .file(tempFile)
                    .model(model);
            if (language != null && !language.isBlank()) {
                params.language(language);
            }

            String text = openAIClient.audio().transcriptions()
                    .create(params.build())
                    .asTranscription()
                    .text()
                    .strip();

            if (text.isEmpty()) {
                log.warn("[Transcription] Empty result with {}", extension);
                return null;
            }
            return text;
        } catch (Exception e) {
            log.warn("[Transcription] Failed with {}: {}", extension, e.getMessage());
            return null;
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[Transcription] Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}

package com.voiceflow.application.workflow;

import com.voiceflow.domain.workflow.model.BrowserEvent;
import com.voiceflow.domain.workflow.model.CorrelationResult;
import com.voiceflow.domain.workflow.model.RecordedStep;
import com.voiceflow.domain.workflow.model.RecordedUtterance;
import com.voiceflow.domain.workflow.model.Transcription;
import com.voiceflow.domain.workflow.model.VoiceEvent;
import com.voiceflow.domain.workflow.model.WorkflowDocument;
import com.voiceflow.domain.workflow.service.TranscriptionService;
import com.voiceflow.infrastructure.correlation.EventCorrelator;
import com.voiceflow.infrastructure.workflow.EnhancedWorkflowGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class VoiceWorkflowAppService {

    private final RecordedEventConverter converter;
    private final EventCorrelator eventCorrelator;
    private final EnhancedWorkflowGenerator workflowGenerator;
    private final TranscriptionService transcriptionService;

    /**
     * Recording session → voice-enhanced workflow (convert → correlate → generate).
     */
    public CompletableFuture<WorkflowDocument> buildWorkflow(String sessionId,
                                                             List<RecordedStep> recordedSteps,
                                                             List<RecordedUtterance> utterances,
                                                             String goal) {
        List<BrowserEvent> browserEvents = converter.toBrowserEvents(recordedSteps, sessionId);
        List<VoiceEvent> voiceEvents = converter.toVoiceEvents(utterances, sessionId);

        List<CorrelationResult> correlations = eventCorrelator.correlate(browserEvents, voiceEvents);

        Map<String, Object> stats = eventCorrelator.statistics(correlations);
        log.info("[VoiceWorkflow] Correlated {} browser events with {} utterances: {}",
                browserEvents.size(), voiceEvents.size(), stats);

        return workflowGenerator.generate(correlations, goal);
    }

    /**
     * Audio clip → utterance for {@link #buildWorkflow}. Empty when transcription fails.
     */
    public Optional<RecordedUtterance> transcribeUtterance(byte[] audio, double timestamp, String url) {
        Transcription transcription = transcriptionService.transcribe(audio);
        if (transcription == null) {
            return Optional.empty();
        }
        return Optional.of(new RecordedUtterance(transcription.text(), timestamp, url, transcription.confidence()));
    }
}

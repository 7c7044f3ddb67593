package com.voiceflow.application.workflow;

import com.voiceflow.domain.workflow.model.BrowserEvent;
import com.voiceflow.domain.workflow.model.RecordedStep;
import com.voiceflow.domain.workflow.model.RecordedUtterance;
import com.voiceflow.domain.workflow.model.VoiceEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts recorder payloads into correlator events.
 * Recorder steps carry epoch milliseconds; events use seconds.
 */
@Component
public class RecordedEventConverter {

    public static final String DEFAULT_SESSION_ID = "current_session";
    public static final double DEFAULT_VOICE_CONFIDENCE = 0.8;

    public List<BrowserEvent> toBrowserEvents(List<RecordedStep> steps, String sessionId) {
        String session = resolveSession(sessionId);
        List<BrowserEvent> events = new ArrayList<>(steps.size());
        for (RecordedStep step : steps) {
            events.add(new BrowserEvent(
                    "browser_" + step.timestampMillis(),
                    step.type(),
                    step.timestampMillis() / 1000.0,
                    step.url(),
                    session,
                    step.xpath(),
                    step.cssSelector(),
                    step.elementTag(),
                    step.value(),
                    step.tabId()));
        }
        return events;
    }

    public List<VoiceEvent> toVoiceEvents(List<RecordedUtterance> utterances, String sessionId) {
        String session = resolveSession(sessionId);
        List<VoiceEvent> events = new ArrayList<>(utterances.size());
        for (int i = 0; i < utterances.size(); i++) {
            RecordedUtterance utterance = utterances.get(i);
            double confidence = utterance.confidence() != null ? utterance.confidence() : DEFAULT_VOICE_CONFIDENCE;
            events.add(new VoiceEvent(
                    "voice_" + i,
                    utterance.text(),
                    utterance.timestamp(),
                    confidence,
                    session,
                    utterance.url()));
        }
        return events;
    }

    private static String resolveSession(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION_ID : sessionId;
    }
}

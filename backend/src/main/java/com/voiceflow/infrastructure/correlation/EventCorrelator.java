package com.voiceflow.infrastructure.correlation;

import com.voiceflow.domain.workflow.model.BrowserEvent;
import com.voiceflow.domain.workflow.model.CorrelationMethod;
import com.voiceflow.domain.workflow.model.CorrelationResult;
import com.voiceflow.domain.workflow.model.CorrelationSettings;
import com.voiceflow.domain.workflow.model.VoiceEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pairs each browser event with the voice events spoken near it.
 *
 * Candidates share the browser event's session and URL and lie within the time window.
 * Candidates are scored by the configured method; a score under the minimum confidence
 * drops the voice events. Every browser event yields exactly one result, in time order.
 */
@Slf4j
public class EventCorrelator {

    static final double HYBRID_TIME_WEIGHT = 0.7;
    static final double HYBRID_SEMANTIC_WEIGHT = 0.3;

    private final CorrelationSettings settings;
    private final KeywordSimilarityScorer similarityScorer;

    public EventCorrelator(CorrelationSettings settings, KeywordSimilarityScorer similarityScorer) {
        this.settings = settings;
        this.similarityScorer = similarityScorer;
    }

    public EventCorrelator() {
        this(CorrelationSettings.DEFAULT, new KeywordSimilarityScorer());
    }

    /**
     * Correlate with the construction-time settings.
     */
    public List<CorrelationResult> correlate(List<BrowserEvent> browserEvents, List<VoiceEvent> voiceEvents) {
        return correlate(browserEvents, voiceEvents, settings);
    }

    public List<CorrelationResult> correlate(List<BrowserEvent> browserEvents,
                                             List<VoiceEvent> voiceEvents,
                                             CorrelationSettings settings) {
        List<BrowserEvent> sortedBrowser = new ArrayList<>(browserEvents);
        sortedBrowser.sort(Comparator.comparingDouble(BrowserEvent::timestamp));
        List<VoiceEvent> sortedVoice = new ArrayList<>(voiceEvents);
        sortedVoice.sort(Comparator.comparingDouble(VoiceEvent::timestamp));

        List<CorrelationResult> results = new ArrayList<>(sortedBrowser.size());

        for (BrowserEvent browserEvent : sortedBrowser) {
            List<VoiceEvent> candidates = findCandidates(browserEvent, sortedVoice, settings.timeWindow());

            if (candidates.isEmpty()) {
                results.add(empty(browserEvent, settings, Map.of()));
                continue;
            }

            CorrelationResult scored = score(browserEvent, candidates, settings);

            if (scored.correlationScore() >= settings.minConfidence()) {
                results.add(scored);
            } else {
                log.debug("[Correlator] {} below min confidence ({} < {}), dropping {} candidates",
                        browserEvent.id(), scored.correlationScore(), settings.minConfidence(), candidates.size());
                results.add(empty(browserEvent, settings, Map.of("low_confidence_voices", candidates.size())));
            }
        }

        long correlated = results.stream().filter(CorrelationResult::hasVoiceEvents).count();
        log.info("[Correlator] method={}, browserEvents={}, voiceEvents={}, correlated={}",
                settings.method().value(), sortedBrowser.size(), sortedVoice.size(), correlated);

        return results;
    }

    private List<VoiceEvent> findCandidates(BrowserEvent browserEvent, List<VoiceEvent> voiceEvents, double timeWindow) {
        List<VoiceEvent> candidates = new ArrayList<>();
        for (VoiceEvent voiceEvent : voiceEvents) {
            double timeDiff = Math.abs(voiceEvent.timestamp() - browserEvent.timestamp());
            if (timeDiff <= timeWindow
                    && equalsNullable(voiceEvent.url(), browserEvent.url())
                    && equalsNullable(voiceEvent.sessionId(), browserEvent.sessionId())) {
                candidates.add(voiceEvent);
            }
        }
        return candidates;
    }

    private CorrelationResult score(BrowserEvent browserEvent, List<VoiceEvent> candidates, CorrelationSettings settings) {
        return switch (settings.method()) {
            case TIME_WINDOW -> timeWindowCorrelation(browserEvent, candidates, settings.timeWindow());
            case SEMANTIC -> semanticCorrelation(browserEvent, candidates, settings.timeWindow());
            case HYBRID -> hybridCorrelation(browserEvent, candidates, settings.timeWindow());
        };
    }

    private CorrelationResult timeWindowCorrelation(BrowserEvent browserEvent, List<VoiceEvent> candidates, double timeWindow) {
        double totalScore = 0.0;
        List<VoiceEvent> validEvents = new ArrayList<>();
        List<Double> timeDifferences = new ArrayList<>();
        List<Double> confidences = new ArrayList<>();

        for (VoiceEvent voiceEvent : candidates) {
            double timeDiff = Math.abs(voiceEvent.timestamp() - browserEvent.timestamp());
            double timeScore = Math.max(0.0, 1.0 - timeDiff / timeWindow);
            double eventScore = timeScore * voiceEvent.confidence();

            if (eventScore > 0) {
                totalScore += eventScore;
                validEvents.add(voiceEvent);
                timeDifferences.add(timeDiff);
                confidences.add(voiceEvent.confidence());
            }
        }

        double avgScore = validEvents.isEmpty() ? 0.0 : totalScore / validEvents.size();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("time_differences", timeDifferences);
        metadata.put("confidence_scores", confidences);

        return new CorrelationResult(browserEvent, List.copyOf(validEvents), avgScore, timeWindow,
                CorrelationMethod.TIME_WINDOW, metadata);
    }

    private CorrelationResult semanticCorrelation(BrowserEvent browserEvent, List<VoiceEvent> candidates, double timeWindow) {
        List<Double> semanticScores = new ArrayList<>();
        for (VoiceEvent voiceEvent : candidates) {
            semanticScores.add(similarityScorer.similarity(browserEvent, voiceEvent));
        }

        double avgScore = semanticScores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("semantic_scores", semanticScores);

        return new CorrelationResult(browserEvent, List.copyOf(candidates), avgScore, timeWindow,
                CorrelationMethod.SEMANTIC, metadata);
    }

    private CorrelationResult hybridCorrelation(BrowserEvent browserEvent, List<VoiceEvent> candidates, double timeWindow) {
        CorrelationResult timeResult = timeWindowCorrelation(browserEvent, candidates, timeWindow);
        CorrelationResult semanticResult = semanticCorrelation(browserEvent, candidates, timeWindow);

        double hybridScore = timeResult.correlationScore() * HYBRID_TIME_WEIGHT
                + semanticResult.correlationScore() * HYBRID_SEMANTIC_WEIGHT;

        Map<String, Object> weights = new LinkedHashMap<>();
        weights.put("time", HYBRID_TIME_WEIGHT);
        weights.put("semantic", HYBRID_SEMANTIC_WEIGHT);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("time_score", timeResult.correlationScore());
        metadata.put("semantic_score", semanticResult.correlationScore());
        metadata.put("weights", weights);

        return new CorrelationResult(browserEvent, List.copyOf(candidates), hybridScore, timeWindow,
                CorrelationMethod.HYBRID, metadata);
    }

    private static CorrelationResult empty(BrowserEvent browserEvent, CorrelationSettings settings,
                                           Map<String, Object> metadata) {
        return new CorrelationResult(browserEvent, List.of(), 0.0, settings.timeWindow(), settings.method(), metadata);
    }

    private static boolean equalsNullable(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    /**
     * Summary of a correlation run. Score-based fields only consider nonzero scores.
     * Returns an empty map for empty input.
     */
    public Map<String, Object> statistics(List<CorrelationResult> results) {
        if (results == null || results.isEmpty()) {
            return Map.of();
        }

        int total = results.size();
        long correlated = results.stream().filter(CorrelationResult::hasVoiceEvents).count();

        List<Double> scores = results.stream()
                .map(CorrelationResult::correlationScore)
                .filter(score -> score > 0)
                .sorted()
                .toList();

        double averageScore = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double averageVoiceEvents = results.stream()
                .mapToInt(r -> r.voiceEvents() == null ? 0 : r.voiceEvents().size())
                .average()
                .orElse(0.0);

        Map<String, Object> distribution = new LinkedHashMap<>();
        distribution.put("min", scores.isEmpty() ? 0.0 : scores.get(0));
        distribution.put("max", scores.isEmpty() ? 0.0 : scores.get(scores.size() - 1));
        distribution.put("median", scores.isEmpty() ? 0.0 : scores.get(scores.size() / 2));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_browser_events", total);
        stats.put("correlated_events", (int) correlated);
        stats.put("correlation_rate", (double) correlated / total);
        stats.put("average_correlation_score", averageScore);
        stats.put("average_voice_events_per_browser_event", averageVoiceEvents);
        stats.put("score_distribution", distribution);
        return stats;
    }
}

package com.voiceflow.domain.workflow.model;

/**
 * Construction-time tunables of the event correlator.
 *
 * @param timeWindow    candidate radius in seconds, also the time-score decay span
 * @param minConfidence correlation acceptance gate
 * @param method        scoring algorithm
 */
public record CorrelationSettings(double timeWindow, double minConfidence, CorrelationMethod method) {

    public static final double DEFAULT_TIME_WINDOW = 5.0;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.3;

    public static final CorrelationSettings DEFAULT =
            new CorrelationSettings(DEFAULT_TIME_WINDOW, DEFAULT_MIN_CONFIDENCE, CorrelationMethod.TIME_WINDOW);

    public CorrelationSettings {
        if (!(timeWindow > 0)) {
            throw new IllegalArgumentException("timeWindow must be positive: " + timeWindow);
        }
        if (minConfidence < 0 || minConfidence > 1) {
            throw new IllegalArgumentException("minConfidence must be within [0, 1]: " + minConfidence);
        }
        if (method == null) {
            throw new IllegalArgumentException("correlation method is required");
        }
    }
}

package com.voiceflow.domain.workflow.model;

/**
 * Step as reported by the recorder extension. Timestamps are epoch milliseconds.
 */
public record RecordedStep(
        String type,
        long timestampMillis,
        String url,
        String xpath,
        String cssSelector,
        String elementTag,
        String value,
        String tabId
) {}

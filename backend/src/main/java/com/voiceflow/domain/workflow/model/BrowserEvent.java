package com.voiceflow.domain.workflow.model;

/**
 * A mechanical browser interaction recorded by the extension.
 *
 * @param id          unique id within the session
 * @param type        click, input, navigation, scroll, select, hover, ...
 * @param timestamp   seconds (recorder milliseconds are converted before correlation)
 * @param url         page URL the interaction happened on
 * @param sessionId   recording session
 * @param xpath       optional locator
 * @param cssSelector optional locator
 * @param elementTag  optional tag name of the target element
 * @param value       optional value (typed text, selected option)
 * @param tabId       optional browser tab id
 */
public record BrowserEvent(
        String id,
        String type,
        double timestamp,
        String url,
        String sessionId,
        String xpath,
        String cssSelector,
        String elementTag,
        String value,
        String tabId
) {
    public BrowserEvent(String id, String type, double timestamp, String url, String sessionId) {
        this(id, type, timestamp, url, sessionId, null, null, null, null, null);
    }
}

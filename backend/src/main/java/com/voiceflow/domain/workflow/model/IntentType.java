package com.voiceflow.domain.workflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classified purpose of a spoken utterance.
 */
public enum IntentType {
    FILTER("filter"),
    SELECT("select"),
    INPUT("input"),
    CLICK("click"),
    NAVIGATE("navigate"),
    CONDITION("condition"),
    VARIABLE("variable"),
    DESCRIPTION("description"),
    UNKNOWN("unknown");

    private final String label;

    IntentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolve a label ("click") or constant name ("CLICK"). Returns null for unrecognized input.
     */
    public static IntentType fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String trimmed = label.trim();
        for (IntentType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null;
    }
}

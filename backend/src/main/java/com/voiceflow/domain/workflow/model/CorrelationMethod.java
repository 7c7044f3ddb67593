package com.voiceflow.domain.workflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CorrelationMethod {
    TIME_WINDOW("time_window"),
    SEMANTIC("semantic"),
    HYBRID("hybrid");

    private final String value;

    CorrelationMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parse a configuration value ("time_window", "semantic", "hybrid"), case-insensitive.
     */
    public static CorrelationMethod fromValue(String value) {
        for (CorrelationMethod method : values()) {
            if (method.value.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown correlation method: " + value);
    }
}

package com.voiceflow.domain.workflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Voice-derived context attached to an enhanced step.
 * errorHandling and smartSelectors are only present when the language model refined the step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VoiceContext(
        List<String> instructions,
        @JsonProperty("intent_types") List<String> intentTypes,
        @JsonProperty("error_handling") String errorHandling,
        @JsonProperty("smart_selectors") List<String> smartSelectors
) {
    public static VoiceContext ruleBased(List<String> instructions, List<String> intentTypes) {
        return new VoiceContext(instructions, intentTypes, null, null);
    }
}

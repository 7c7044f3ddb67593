package com.voiceflow.domain.workflow.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One step of the generated workflow, derived from a single browser event and
 * optionally enriched with voice context. Enrichment produces a new instance via toBuilder().
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnhancedWorkflowStep {
    String id;
    String type;
    String action;
    String target;
    String value;
    String xpath;
    String cssSelector;

    VoiceContext voiceContext;
    Map<String, String> extractedVariables;
    List<String> conditions;
    boolean enhanced;
}

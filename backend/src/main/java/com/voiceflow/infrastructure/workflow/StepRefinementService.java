package com.voiceflow.infrastructure.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voiceflow.domain.workflow.model.EnhancedWorkflowStep;
import com.voiceflow.domain.workflow.model.IntentAnalysisResult;
import com.voiceflow.domain.workflow.model.StepRefinement;
import com.voiceflow.infrastructure.ai.LanguageModelClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the language model to refine one step and validates the reply.
 *
 * Never throws: call failures and malformed replies come back as {@link StepRefinement#failure}.
 * A reply is accepted only when the root is a JSON object and every present field has the
 * expected shape. Absent (or null) fields take their defaults.
 */
@Slf4j
@RequiredArgsConstructor
public class StepRefinementService {

    private final LanguageModelClient languageModelClient;
    private final StepPromptBuilder promptBuilder;
    private final ObjectMapper objectMapper;

    public StepRefinement refine(EnhancedWorkflowStep step, List<String> voiceTexts,
                                 List<IntentAnalysisResult> analyses) {
        String reply;
        try {
            reply = languageModelClient.complete(
                    promptBuilder.systemPrompt(),
                    promptBuilder.buildUserPrompt(step, voiceTexts, analyses));
        } catch (Exception e) {
            log.warn("[StepRefinement] {} LLM call failed: {}", step.getId(), e.getMessage());
            return StepRefinement.failure("call failed: " + e.getMessage());
        }

        return parse(step.getId(), reply);
    }

    StepRefinement parse(String stepId, String reply) {
        JsonNode root;
        try {
            root = objectMapper.readTree(reply == null ? "" : reply);
        } catch (Exception e) {
            log.warn("[StepRefinement] {} reply is not valid JSON: {}", stepId, e.getMessage());
            return StepRefinement.failure("invalid JSON");
        }

        if (root == null || !root.isObject()) {
            log.warn("[StepRefinement] {} reply root is not a JSON object", stepId);
            return StepRefinement.failure("reply is not a JSON object");
        }

        try {
            String enhancedAction = readText(root, "enhanced_action");
            List<String> conditions = readScalarArray(root, "conditions");
            Map<String, String> variables = readScalarObject(root, "variables");
            String errorHandling = readText(root, "error_handling");
            List<String> smartSelectors = readScalarArray(root, "smart_selectors");

            return StepRefinement.success(enhancedAction, conditions, variables, errorHandling, smartSelectors);
        } catch (MalformedReplyException e) {
            log.warn("[StepRefinement] {} malformed reply: {}", stepId, e.getMessage());
            return StepRefinement.failure(e.getMessage());
        }
    }

    private static String readText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new MalformedReplyException(field + " must be a string");
        }
        return node.asText();
    }

    private static List<String> readScalarArray(JsonNode root, String field) {
        JsonNode node = root.get(field);
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (!node.isArray()) {
            throw new MalformedReplyException(field + " must be an array");
        }
        for (JsonNode element : node) {
            if (!isScalar(element)) {
                throw new MalformedReplyException(field + " must contain only scalar values");
            }
            values.add(element.asText());
        }
        return values;
    }

    private static Map<String, String> readScalarObject(JsonNode root, String field) {
        JsonNode node = root.get(field);
        Map<String, String> values = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (!node.isObject()) {
            throw new MalformedReplyException(field + " must be an object");
        }
        var it = node.fields();
        while (it.hasNext()) {
            var entry = it.next();
            if (!isScalar(entry.getValue())) {
                throw new MalformedReplyException(field + "." + entry.getKey() + " must be a scalar value");
            }
            values.put(entry.getKey(), entry.getValue().asText());
        }
        return values;
    }

    private static boolean isScalar(JsonNode node) {
        return node.isValueNode() && !node.isNull();
    }

    private static class MalformedReplyException extends RuntimeException {
        MalformedReplyException(String message) {
            super(message);
        }
    }
}

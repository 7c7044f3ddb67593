package com.voiceflow.infrastructure.intent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voiceflow.domain.workflow.model.IntentType;
import com.voiceflow.domain.workflow.model.SemanticIntent;
import com.voiceflow.infrastructure.ai.LanguageModelClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Semantic intent refinement through the language model.
 * Asks for a JSON object (intent_type, confidence, variables, conditions, parameters).
 * Unknown intent labels come back as a null intent type, which keeps the rule-based one.
 */
@Slf4j
@RequiredArgsConstructor
public class LlmIntentEnhancer implements IntentSemanticEnhancer {

    private final LanguageModelClient languageModelClient;
    private final ObjectMapper objectMapper;

    static final String SYSTEM_PROMPT = """
            你是浏览器自动化录制场景中的语音意图分析专家。
            用户在录制网页操作时会口述说明，你需要判断这句话的意图，并提取变量、条件和参数。

            ## 意图类型
            filter, select, input, click, navigate, condition, variable, description, unknown

            ## 规则
            1. intent_type 只能是上面列出的小写值之一
            2. confidence 为 0 到 1 之间的数字
            3. variables: 变量名 → 占位符，占位符格式为 ${变量名}
            4. conditions: 每条写成 "if 条件 then 动作"
            5. parameters: 与意图相关的参数，例如 count、time_filter、value
            6. 没有把握的字段留空，不要猜测

            ## 输出格式 (只输出 JSON)
            {
              "intent_type": "input",
              "confidence": 0.9,
              "variables": {"username": "${username}"},
              "conditions": [],
              "parameters": {"value": "admin"}
            }""";

    @Override
    public Optional<SemanticIntent> enhance(String processedText, IntentType ruleIntent) {
        String userMessage = "规则识别结果: " + ruleIntent.label() + "\n\n语音内容:\n" + processedText;

        String reply;
        try {
            reply = languageModelClient.complete(SYSTEM_PROMPT, userMessage);
        } catch (Exception e) {
            log.warn("[IntentAnalyzer] Semantic enhancement call failed: {}", e.getMessage());
            return Optional.empty();
        }

        return parse(reply);
    }

    private Optional<SemanticIntent> parse(String reply) {
        try {
            JsonNode root = objectMapper.readTree(reply);
            if (root == null || !root.isObject()) {
                log.warn("[IntentAnalyzer] Semantic enhancement reply is not a JSON object");
                return Optional.empty();
            }

            IntentType intentType = IntentType.fromLabel(root.path("intent_type").asText(""));

            double confidence = Math.max(0.0, Math.min(root.path("confidence").asDouble(0.0), 1.0));

            Map<String, String> variables = new LinkedHashMap<>();
            JsonNode variablesNode = root.path("variables");
            if (variablesNode.isObject()) {
                variablesNode.fields().forEachRemaining(entry ->
                        variables.put(entry.getKey(), entry.getValue().asText()));
            }

            List<String> conditions = new ArrayList<>();
            JsonNode conditionsNode = root.path("conditions");
            if (conditionsNode.isArray()) {
                for (JsonNode condition : conditionsNode) {
                    String text = condition.asText("");
                    if (!text.isBlank()) {
                        conditions.add(text);
                    }
                }
            }

            Map<String, Object> parameters = new LinkedHashMap<>();
            JsonNode parametersNode = root.path("parameters");
            if (parametersNode.isObject()) {
                parametersNode.fields().forEachRemaining(entry ->
                        parameters.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Object.class)));
            }

            return Optional.of(new SemanticIntent(intentType, confidence, variables, conditions, parameters));
        } catch (Exception e) {
            log.warn("[IntentAnalyzer] Semantic enhancement parse failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}

package com.voiceflow.infrastructure.workflow;

import com.voiceflow.domain.workflow.model.EnhancedWorkflowStep;
import com.voiceflow.domain.workflow.model.IntentAnalysisResult;

import java.util.List;
import java.util.Locale;

/**
 * Prompts for single-step refinement.
 * The system prompt fixes the JSON reply contract; the user prompt carries the recorded
 * operation, what the user said while performing it, and the rule-based intent reading.
 */
public class StepPromptBuilder {

    static final String SYSTEM_PROMPT = """
            你是一个工作流增强专家。根据浏览器操作和对应的语音指令，生成更智能的工作流步骤。

            ## 分析要点
            1. 条件逻辑（如果...则...）
            2. 变量提取（用户名、密码等参数化内容）
            3. 操作意图（点击、输入、导航等）
            4. 错误处理提示

            ## 输出格式 (只输出 JSON，不要输出其他文字)
            {
              "enhanced_action": "增强后的动作描述",
              "conditions": ["条件1", "条件2"],
              "variables": {"var_name": "${var_name}"},
              "error_handling": "错误处理逻辑",
              "smart_selectors": ["智能选择器1", "智能选择器2"]
            }

            ## 规则
            - 没有对应信息的字段可以省略
            - conditions 每一项写成 "if 条件 then 动作"
            - variables 的值使用 ${变量名} 占位符，不要写入录制时的实际值""";

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String buildUserPrompt(EnhancedWorkflowStep step, List<String> voiceTexts,
                                  List<IntentAnalysisResult> analyses) {
        StringBuilder sb = new StringBuilder();
        sb.append("原始浏览器操作:\n");
        sb.append("- 类型: ").append(step.getType()).append("\n");
        sb.append("- 动作: ").append(step.getAction()).append("\n");
        sb.append("- 目标: ").append(step.getTarget()).append("\n");
        sb.append("- XPath: ").append(step.getXpath()).append("\n");
        if (step.getValue() != null && !step.getValue().isBlank()) {
            sb.append("- 值: ").append(step.getValue()).append("\n");
        }

        sb.append("\n对应的语音指令:\n");
        for (String text : voiceTexts) {
            sb.append("- ").append(text).append("\n");
        }

        sb.append("\n语音意图分析:\n");
        for (IntentAnalysisResult analysis : analyses) {
            sb.append("- 意图: ").append(analysis.intentType().label())
                    .append(", 置信度: ").append(String.format(Locale.ROOT, "%.2f", analysis.confidence()))
                    .append("\n");
        }

        sb.append("\n请生成增强的工作流步骤信息。");
        return sb.toString();
    }
}

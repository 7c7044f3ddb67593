package com.voiceflow.infrastructure.workflow;

import com.voiceflow.domain.workflow.model.EnhancedWorkflowStep;
import com.voiceflow.domain.workflow.model.WorkflowCondition;
import com.voiceflow.domain.workflow.model.WorkflowVariable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowAggregatorTest {

    private final WorkflowAggregator aggregator = new WorkflowAggregator();

    private static EnhancedWorkflowStep step(String id, Map<String, String> variables, List<String> conditions) {
        return EnhancedWorkflowStep.builder()
                .id(id).type("click").action("click_element")
                .extractedVariables(variables).conditions(conditions)
                .enhanced(variables != null)
                .build();
    }

    @Test
    @DisplayName("变量先到先得")
    void 变量先到先得() {
        Map<String, WorkflowVariable> variables = aggregator.collectVariables(List.of(
                step("step_1", Map.of("username", "${username}"), List.of()),
                step("step_2", null, null),
                step("step_3", Map.of("username", "${other}"), List.of())));

        assertThat(variables).containsExactly(Map.entry("username",
                new WorkflowVariable("string", "${username}", "Extracted from voice: ${username}")));
    }

    @Test
    @DisplayName("条件按步骤与出现顺序排列")
    void 条件顺序() {
        List<WorkflowCondition> conditions = aggregator.collectConditions(List.of(
                step("step_1", Map.of(), List.of("if a then b", "if c then d")),
                step("step_2", null, null),
                step("step_3", Map.of(), List.of("if e then f"))));

        assertThat(conditions).containsExactly(
                new WorkflowCondition("if a then b", "step_1", "voice_extracted"),
                new WorkflowCondition("if c then d", "step_1", "voice_extracted"),
                new WorkflowCondition("if e then f", "step_3", "voice_extracted"));
    }
}

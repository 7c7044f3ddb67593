package com.voiceflow.infrastructure.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voiceflow.domain.workflow.model.BrowserEvent;
import com.voiceflow.domain.workflow.model.CorrelationMethod;
import com.voiceflow.domain.workflow.model.CorrelationResult;
import com.voiceflow.domain.workflow.model.EnhancedWorkflowStep;
import com.voiceflow.domain.workflow.model.VoiceEvent;
import com.voiceflow.domain.workflow.model.WorkflowCondition;
import com.voiceflow.domain.workflow.model.WorkflowDocument;
import com.voiceflow.domain.workflow.model.WorkflowVariable;
import com.voiceflow.infrastructure.ai.LanguageModelClient;
import com.voiceflow.infrastructure.ai.LanguageModelException;
import com.voiceflow.infrastructure.intent.IntentAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnhancedWorkflowGeneratorTest {

    private static final String URL = "https://example.com/login";
    private static final String SESSION = "session_1";

    private static final String REFINED_REPLY = """
            {
              "enhanced_action": "点击登录按钮提交表单",
              "conditions": ["if 表单无效 then 停止"],
              "variables": {"username": "${username}"},
              "error_handling": "失败时重试一次",
              "smart_selectors": ["button[type=submit]", "#login"]
            }""";

    @Mock
    private LanguageModelClient languageModelClient;

    private EnhancedWorkflowGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new EnhancedWorkflowGenerator(languageModelClient, new IntentAnalyzer(), new ObjectMapper(),
                Runnable::run, Duration.ofSeconds(5));
    }

    private static BrowserEvent event(String type, double timestamp, String tag) {
        return new BrowserEvent("browser_" + (long) (timestamp * 1000), type, timestamp, URL, SESSION,
                "//" + tag, "#" + tag, tag, null, "1");
    }

    private static CorrelationResult correlated(BrowserEvent event, String... utterances) {
        List<VoiceEvent> voices = new java.util.ArrayList<>();
        for (int i = 0; i < utterances.length; i++) {
            voices.add(new VoiceEvent("voice_" + i, utterances[i], event.timestamp() + 0.5, 0.9, SESSION, URL));
        }
        return new CorrelationResult(event, voices, voices.isEmpty() ? 0.0 : 0.81, 5.0,
                CorrelationMethod.TIME_WINDOW, Map.of());
    }

    private WorkflowDocument generate(List<CorrelationResult> correlations, String goal) throws Exception {
        return generator.generate(correlations, goal).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("语言模型客户端为空时构造失败")
    void 客户端为空() {
        assertThatThrownBy(() -> new EnhancedWorkflowGenerator(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("基础步骤")
    class BaseSteps {

        @Test
        @DisplayName("无语音的步骤不增强, 不调用语言模型")
        void 无语音_不增强() throws Exception {
            WorkflowDocument document = generate(List.of(correlated(event("click", 1.0, "button"))), "登录");

            EnhancedWorkflowStep step = document.steps().get(0);
            assertThat(step.getId()).isEqualTo("step_1");
            assertThat(step.getAction()).isEqualTo("click_element");
            assertThat(step.getTarget()).isEqualTo("button");
            assertThat(step.getXpath()).isEqualTo("//button");
            assertThat(step.getCssSelector()).isEqualTo("#button");
            assertThat(step.isEnhanced()).isFalse();
            assertThat(step.getVoiceContext()).isNull();
            verify(languageModelClient, never()).complete(anyString(), anyString());
        }

        @Test
        @DisplayName("全部无语音 → 步骤都不增强, 变量与条件为空")
        void 全部无语音() throws Exception {
            WorkflowDocument document = generate(List.of(
                    correlated(event("click", 1.0, "button")),
                    correlated(event("input", 2.0, "input")),
                    correlated(event("navigation", 3.0, "a"))), null);

            assertThat(document.steps()).hasSize(3).noneMatch(EnhancedWorkflowStep::isEnhanced);
            assertThat(document.variables()).isEmpty();
            assertThat(document.conditions()).isEmpty();
            assertThat(document.metadata().browserEventsCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("事件类型 → 动作")
        void 事件类型_动作() {
            assertThat(EnhancedWorkflowGenerator.actionFor("click")).isEqualTo("click_element");
            assertThat(EnhancedWorkflowGenerator.actionFor("input")).isEqualTo("input_text");
            assertThat(EnhancedWorkflowGenerator.actionFor("navigation")).isEqualTo("navigate_to");
            assertThat(EnhancedWorkflowGenerator.actionFor("scroll")).isEqualTo("scroll_page");
            assertThat(EnhancedWorkflowGenerator.actionFor("select")).isEqualTo("select_option");
            assertThat(EnhancedWorkflowGenerator.actionFor("hover")).isEqualTo("hover_element");
            assertThat(EnhancedWorkflowGenerator.actionFor("drag")).isEqualTo("perform_action");
            assertThat(EnhancedWorkflowGenerator.actionFor(null)).isEqualTo("perform_action");
        }

        @Test
        @DisplayName("空输入 → 零步骤文档")
        void 空输入() throws Exception {
            WorkflowDocument document = generate(List.of(), null);

            assertThat(document.steps()).isEmpty();
            assertThat(document.variables()).isEmpty();
            assertThat(document.conditions()).isEmpty();
            assertThat(document.metadata().browserEventsCount()).isZero();
            assertThat(document.metadata().voiceEventsCount()).isZero();
        }
    }

    @Nested
    @DisplayName("语言模型增强")
    class Refinement {

        @Test
        @DisplayName("成功回复覆盖动作并附加语音上下文")
        void 成功回复() throws Exception {
            when(languageModelClient.complete(anyString(), anyString())).thenReturn(REFINED_REPLY);

            WorkflowDocument document = generate(
                    List.of(correlated(event("click", 1.0, "button"), "点击登录按钮")), "登录系统");

            EnhancedWorkflowStep step = document.steps().get(0);
            assertThat(step.isEnhanced()).isTrue();
            assertThat(step.getAction()).isEqualTo("点击登录按钮提交表单");
            assertThat(step.getConditions()).containsExactly("if 表单无效 then 停止");
            assertThat(step.getExtractedVariables()).containsEntry("username", "${username}");
            assertThat(step.getVoiceContext().instructions()).containsExactly("点击登录按钮");
            assertThat(step.getVoiceContext().intentTypes()).containsExactly("click");
            assertThat(step.getVoiceContext().errorHandling()).isEqualTo("失败时重试一次");
            assertThat(step.getVoiceContext().smartSelectors()).containsExactly("button[type=submit]", "#login");

            assertThat(document.variables()).containsEntry("username",
                    new WorkflowVariable("string", "${username}", "Extracted from voice: ${username}"));
            assertThat(document.conditions()).containsExactly(
                    new WorkflowCondition("if 表单无效 then 停止", "step_1", "voice_extracted"));
        }

        @Test
        @DisplayName("回复缺少字段 → 保留动作, 其余取默认值")
        void 缺少字段() throws Exception {
            when(languageModelClient.complete(anyString(), anyString())).thenReturn("{\"error_handling\": \"跳过\"}");

            WorkflowDocument document = generate(
                    List.of(correlated(event("click", 1.0, "button"), "点击登录按钮")), null);

            EnhancedWorkflowStep step = document.steps().get(0);
            assertThat(step.isEnhanced()).isTrue();
            assertThat(step.getAction()).isEqualTo("click_element");
            assertThat(step.getConditions()).isEmpty();
            assertThat(step.getExtractedVariables()).isEmpty();
            assertThat(step.getVoiceContext().errorHandling()).isEqualTo("跳过");
            assertThat(step.getVoiceContext().smartSelectors()).isEmpty();
        }
    }

    @Nested
    @DisplayName("规则降级")
    class Fallback {

        @Test
        @DisplayName("回复不是 JSON → 规则增强")
        void 非JSON() throws Exception {
            when(languageModelClient.complete(anyString(), anyString())).thenReturn("这不是 JSON");

            EnhancedWorkflowStep step = generate(
                    List.of(correlated(event("input", 1.0, "input"), "输入用户名admin")), null).steps().get(0);

            assertRuleBased(step);
        }

        @Test
        @DisplayName("字段类型错误 → 规则增强")
        void 字段类型错误() throws Exception {
            when(languageModelClient.complete(anyString(), anyString()))
                    .thenReturn("{\"conditions\": \"not a list\"}");

            EnhancedWorkflowStep step = generate(
                    List.of(correlated(event("input", 1.0, "input"), "输入用户名admin")), null).steps().get(0);

            assertRuleBased(step);
        }

        @Test
        @DisplayName("调用异常 → 规则增强, 文档仍然生成")
        void 调用异常() throws Exception {
            when(languageModelClient.complete(anyString(), anyString()))
                    .thenThrow(new LanguageModelException("rate limited"));

            WorkflowDocument document = generate(
                    List.of(correlated(event("input", 1.0, "input"), "输入用户名admin")), null);

            assertRuleBased(document.steps().get(0));
            assertThat(document.variables()).containsKey("username");
        }

        @Test
        @DisplayName("超时 → 仅该步骤降级")
        void 超时() throws Exception {
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                EnhancedWorkflowGenerator slowGenerator = new EnhancedWorkflowGenerator(languageModelClient,
                        new IntentAnalyzer(), new ObjectMapper(), executor, Duration.ofMillis(100));
                when(languageModelClient.complete(anyString(), anyString())).thenAnswer(invocation -> {
                    Thread.sleep(2000);
                    return REFINED_REPLY;
                });

                WorkflowDocument document = slowGenerator.generate(
                        List.of(correlated(event("input", 1.0, "input"), "输入用户名admin")), null)
                        .get(5, TimeUnit.SECONDS);

                assertRuleBased(document.steps().get(0));
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("慢步骤超时降级, 排队的兄弟步骤仍被增强, 超时调用被中断")
        void 超时_不影响排队步骤() throws Exception {
            ExecutorService executor = Executors.newSingleThreadExecutor();
            AtomicBoolean slowCallInterrupted = new AtomicBoolean(false);
            try {
                EnhancedWorkflowGenerator slowGenerator = new EnhancedWorkflowGenerator(languageModelClient,
                        new IntentAnalyzer(), new ObjectMapper(), executor, Duration.ofMillis(500));
                when(languageModelClient.complete(anyString(), anyString())).thenAnswer(invocation -> {
                    String userPrompt = invocation.getArgument(1);
                    if (userPrompt.contains("输入用户名admin")) {
                        try {
                            Thread.sleep(1500);
                        } catch (InterruptedException e) {
                            slowCallInterrupted.set(true);
                            throw new LanguageModelException("interrupted", e);
                        }
                        return REFINED_REPLY;
                    }
                    return "{\"enhanced_action\": \"REFINED\"}";
                });

                WorkflowDocument document = slowGenerator.generate(List.of(
                                correlated(event("input", 1.0, "input"), "输入用户名admin"),
                                correlated(event("click", 2.0, "button"), "点击提交按钮")), null)
                        .get(5, TimeUnit.SECONDS);

                assertRuleBased(document.steps().get(0));
                assertThat(document.steps().get(1).getAction()).isEqualTo("REFINED");
                assertThat(document.steps().get(1).isEnhanced()).isTrue();
                assertThat(slowCallInterrupted).isTrue();
            } finally {
                executor.shutdownNow();
            }
        }

        private void assertRuleBased(EnhancedWorkflowStep step) {
            assertThat(step.isEnhanced()).isTrue();
            assertThat(step.getAction()).isEqualTo("input_text");
            assertThat(step.getExtractedVariables()).containsEntry("username", "${username}");
            assertThat(step.getConditions()).isEmpty();
            assertThat(step.getVoiceContext().instructions()).containsExactly("输入用户名admin");
            assertThat(step.getVoiceContext().intentTypes()).containsExactly("input");
            assertThat(step.getVoiceContext().errorHandling()).isNull();
            assertThat(step.getVoiceContext().smartSelectors()).isNull();
        }
    }

    @Nested
    @DisplayName("文档组装")
    class Assembly {

        @Test
        @DisplayName("描述缺省与元数据计数")
        void 描述_元数据() throws Exception {
            when(languageModelClient.complete(anyString(), anyString())).thenReturn("{}");

            WorkflowDocument document = generate(List.of(
                    correlated(event("click", 1.0, "button"), "点击提交", "确认"),
                    correlated(event("scroll", 3.0, "div"))), "  ");

            assertThat(document.name()).isEqualTo("Enhanced Voice Workflow");
            assertThat(document.description()).isEqualTo("Voice-enhanced browser automation workflow");
            assertThat(document.version()).isEqualTo("1.0");
            assertThat(document.metadata().enhanced()).isTrue();
            assertThat(document.metadata().voiceEventsCount()).isEqualTo(2);
            assertThat(document.metadata().browserEventsCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("变量先到先得, 条件按步骤顺序")
        void 变量_条件顺序() throws Exception {
            when(languageModelClient.complete(anyString(), anyString())).thenReturn(
                    "{\"variables\": {\"username\": \"${username}\"}, \"conditions\": [\"if a then b\"]}",
                    "{\"variables\": {\"username\": \"${user}\", \"password\": \"${password}\"}, \"conditions\": [\"if c then d\"]}");

            WorkflowDocument document = generate(List.of(
                    correlated(event("input", 1.0, "input"), "输入用户名"),
                    correlated(event("input", 2.0, "input"), "输入密码")), "登录");

            assertThat(document.description()).isEqualTo("登录");
            assertThat(document.variables()).containsOnlyKeys("username", "password");
            assertThat(document.variables().get("username").defaultValue()).isEqualTo("${username}");
            assertThat(document.conditions()).extracting(WorkflowCondition::stepId)
                    .containsExactly("step_1", "step_2");
            assertThat(document.steps()).extracting(EnhancedWorkflowStep::getId)
                    .containsExactly("step_1", "step_2");
        }

        @Test
        @DisplayName("并发增强时步骤顺序与输入一致")
        void 并发_顺序() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                EnhancedWorkflowGenerator concurrent = new EnhancedWorkflowGenerator(languageModelClient,
                        new IntentAnalyzer(), new ObjectMapper(), executor, Duration.ofSeconds(5));
                when(languageModelClient.complete(anyString(), anyString())).thenReturn("{}");

                List<CorrelationResult> correlations = new java.util.ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    correlations.add(correlated(event("click", i, "button"), "点击第" + i + "个按钮"));
                }

                WorkflowDocument document = concurrent.generate(correlations, null).get(5, TimeUnit.SECONDS);

                assertThat(document.steps()).extracting(EnhancedWorkflowStep::getId)
                        .containsExactly("step_1", "step_2", "step_3", "step_4",
                                "step_5", "step_6", "step_7", "step_8");
                assertThat(document.steps()).allMatch(EnhancedWorkflowStep::isEnhanced);
            } finally {
                executor.shutdownNow();
            }
        }
    }
}

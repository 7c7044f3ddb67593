package com.voiceflow.infrastructure.intent;

import com.voiceflow.domain.workflow.model.IntentAnalysisResult;
import com.voiceflow.domain.workflow.model.IntentType;
import com.voiceflow.domain.workflow.model.SemanticIntent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based intent classification for spoken step annotations.
 *
 * Pipeline per utterance:
 * 1. Normalize (whitespace, clause punctuation, case)
 * 2. Classify by regex match density, rules checked in priority order
 * 3. Extract variables and conditions (always) and intent-specific parameters
 * 4. Merge an optional semantic refinement on top
 */
@Slf4j
public class IntentAnalyzer {

    private record IntentRule(IntentType type, List<Pattern> patterns) {}

    // Priority order: on equal confidence the earlier rule wins.
    private static final List<IntentRule> RULES = List.of(
            new IntentRule(IntentType.CONDITION, compileAll(
                    "如果.*就|假如.*则|当.*时.*就|要是.*就",
                    "当.*时|当.*的时候",
                    "没有.*就|为空.*就|不存在.*就",
                    "否则|不然|要不然")),
            new IntentRule(IntentType.DESCRIPTION, compileAll(
                    "^这是(?!.*输入)",
                    "^这里是",
                    "^现在是",
                    "^这里用来(?!.*输入)",
                    "^用来|^用于|^为了",
                    "^目的是|^作用是")),
            new IntentRule(IntentType.NAVIGATE, compileAll(
                    "跳转到|转到|打开.*页面|访问.*页面",
                    "回到|返回到|切换到",
                    "进入.*页面|前往.*页面")),
            new IntentRule(IntentType.FILTER, compileAll(
                    "筛选|过滤|查找|搜索|找到.*的",
                    "显示.*条|最新的.*条|前.*个",
                    "只要|只显示|仅显示")),
            new IntentRule(IntentType.SELECT, compileAll(
                    "选择|选中|勾选|点选",
                    "全选|选择所有|选择全部",
                    "取消选择|不选")),
            new IntentRule(IntentType.INPUT, compileAll(
                    "输入(?!.*页面)",
                    "填写|填入|写入",
                    "设置.*为|改为|修改.*为",
                    "修改|更改|变更")),
            new IntentRule(IntentType.CLICK, compileAll(
                    "点击(?!.*页面)",
                    "按(?!.*页面)|按下",
                    "提交|确认|保存|取消",
                    "下一步|上一步(?!.*页面)")),
            new IntentRule(IntentType.VARIABLE, compileAll(
                    "\\{.*\\}|变量.*|参数.*",
                    "这里用.*代替|用.*替换",
                    "动态.*|可变.*"))
    );

    private final TranscriptNormalizer normalizer;
    private final VariableExtractor variableExtractor;
    private final ConditionExtractor conditionExtractor;
    private final ParameterExtractor parameterExtractor;
    private final IntentSemanticEnhancer semanticEnhancer;

    public IntentAnalyzer() {
        this(null);
    }

    public IntentAnalyzer(IntentSemanticEnhancer semanticEnhancer) {
        this(new TranscriptNormalizer(), new VariableExtractor(), new ConditionExtractor(),
                new ParameterExtractor(), semanticEnhancer);
    }

    public IntentAnalyzer(TranscriptNormalizer normalizer,
                          VariableExtractor variableExtractor,
                          ConditionExtractor conditionExtractor,
                          ParameterExtractor parameterExtractor,
                          IntentSemanticEnhancer semanticEnhancer) {
        this.normalizer = normalizer;
        this.variableExtractor = variableExtractor;
        this.conditionExtractor = conditionExtractor;
        this.parameterExtractor = parameterExtractor;
        this.semanticEnhancer = semanticEnhancer;
    }

    public IntentAnalysisResult analyze(String text) {
        String processed = normalizer.normalize(text);

        IntentType intentType = IntentType.UNKNOWN;
        double confidence = 0.0;

        int wordCount = normalizer.wordCount(processed);
        if (wordCount > 0) {
            for (IntentRule rule : RULES) {
                int matches = countMatches(rule.patterns(), processed);
                if (matches == 0) {
                    continue;
                }
                double score = Math.min((double) matches / wordCount * 2, 1.0);
                if (score > confidence) {
                    intentType = rule.type();
                    confidence = score;
                }
            }
        }

        Map<String, String> variables = variableExtractor.extract(processed);
        List<String> conditions = conditionExtractor.extract(processed);
        Map<String, Object> parameters = parameterExtractor.extract(processed, intentType);

        IntentAnalysisResult result = new IntentAnalysisResult(
                intentType, confidence, variables, conditions, parameters,
                text == null ? "" : text, processed);

        log.debug("[IntentAnalyzer] '{}' → {} ({})", processed, intentType.label(), confidence);

        if (semanticEnhancer == null || processed.isEmpty()) {
            return result;
        }
        return applySemanticEnhancement(result);
    }

    public List<IntentAnalysisResult> batchAnalyze(List<String> texts) {
        List<IntentAnalysisResult> results = new ArrayList<>(texts.size());
        for (String text : texts) {
            results.add(analyze(text));
        }
        return results;
    }

    private IntentAnalysisResult applySemanticEnhancement(IntentAnalysisResult base) {
        Optional<SemanticIntent> refinement;
        try {
            refinement = semanticEnhancer.enhance(base.processedText(), base.intentType());
        } catch (Exception e) {
            log.warn("[IntentAnalyzer] Semantic enhancement failed, keeping rule-based result: {}", e.getMessage());
            return base;
        }

        if (refinement == null || refinement.isEmpty()) {
            log.warn("[IntentAnalyzer] Semantic enhancement returned nothing, keeping rule-based result");
            return base;
        }

        SemanticIntent semantic = refinement.get();

        IntentType intentType = semantic.intentType() != null ? semantic.intentType() : base.intentType();
        double confidence = Math.max(base.confidence(), semantic.confidence());

        Map<String, String> variables = new LinkedHashMap<>(base.extractedVariables());
        if (semantic.variables() != null) {
            variables.putAll(semantic.variables());
        }

        List<String> conditions = new ArrayList<>(base.conditions());
        if (semantic.conditions() != null) {
            conditions.addAll(semantic.conditions());
        }

        Map<String, Object> parameters = new LinkedHashMap<>(base.parameters());
        if (semantic.parameters() != null) {
            parameters.putAll(semantic.parameters());
        }

        return new IntentAnalysisResult(intentType, confidence, variables, conditions, parameters,
                base.rawText(), base.processedText());
    }

    private static int countMatches(List<Pattern> patterns, String text) {
        int count = 0;
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                count++;
            }
        }
        return count;
    }

    private static List<Pattern> compileAll(String... regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.length);
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        return List.copyOf(patterns);
    }
}

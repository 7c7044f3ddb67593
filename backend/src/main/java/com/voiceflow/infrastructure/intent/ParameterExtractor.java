package com.voiceflow.infrastructure.intent;

import com.voiceflow.domain.workflow.model.IntentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Intent-specific parameter extraction.
 * FILTER: count, time_filter. INPUT: value. SELECT: select_all / deselect.
 */
@Slf4j
@Component
public class ParameterExtractor {

    public static final String COUNT = "count";
    public static final String TIME_FILTER = "time_filter";
    public static final String VALUE = "value";
    public static final String SELECT_ALL = "select_all";
    public static final String DESELECT = "deselect";

    private static final Pattern COUNT_PATTERN = Pattern.compile("(\\d+)条|(\\d+)个|(\\d+)项");
    private static final Pattern TIME_PATTERN = Pattern.compile("最新|最近|今天|昨天|本周|本月");

    private static final List<Pattern> VALUE_PATTERNS = List.of(
            Pattern.compile("输入(.+?)(?:,|$)"),
            Pattern.compile("填写(.+?)(?:,|$)"),
            Pattern.compile("设置为(.+?)(?:,|$)")
    );

    public Map<String, Object> extract(String text, IntentType intentType) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        if (text == null || text.isEmpty() || intentType == null) {
            return parameters;
        }

        switch (intentType) {
            case FILTER -> extractFilterParameters(text, parameters);
            case INPUT -> extractInputValue(text, parameters);
            case SELECT -> extractSelectScope(text, parameters);
            default -> {
                // no parameters for other intents
            }
        }

        return parameters;
    }

    private void extractFilterParameters(String text, Map<String, Object> parameters) {
        Matcher countMatch = COUNT_PATTERN.matcher(text);
        if (countMatch.find()) {
            String digits = firstNonNullGroup(countMatch);
            try {
                parameters.put(COUNT, Integer.parseInt(digits));
            } catch (NumberFormatException e) {
                log.debug("[IntentAnalyzer] Count '{}' out of integer range, skipping", digits);
            }
        }

        Matcher timeMatch = TIME_PATTERN.matcher(text);
        if (timeMatch.find()) {
            parameters.put(TIME_FILTER, timeMatch.group());
        }
    }

    private void extractInputValue(String text, Map<String, Object> parameters) {
        for (Pattern pattern : VALUE_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                parameters.put(VALUE, m.group(1).strip());
                return;
            }
        }
    }

    private void extractSelectScope(String text, Map<String, Object> parameters) {
        if (text.contains("全选") || text.contains("所有")) {
            parameters.put(SELECT_ALL, true);
        } else if (text.contains("取消")) {
            parameters.put(DESELECT, true);
        }
    }

    private static String firstNonNullGroup(Matcher m) {
        for (int i = 1; i <= m.groupCount(); i++) {
            if (m.group(i) != null) {
                return m.group(i);
            }
        }
        return m.group();
    }
}

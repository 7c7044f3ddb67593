package com.voiceflow.infrastructure.correlation;

import com.voiceflow.domain.workflow.model.BrowserEvent;
import com.voiceflow.domain.workflow.model.VoiceEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-overlap similarity between a browser event and an utterance.
 *
 * similarity = max(typeRatio, tagRatio), clamped to [0, 1], where each ratio is the share of
 * the keyword set found as substrings of the lower-cased utterance text.
 */
@Component
public class KeywordSimilarityScorer {

    private static final Map<String, List<String>> TYPE_KEYWORDS = Map.of(
            "click", List.of("点击", "按", "点", "选择", "确认", "提交"),
            "input", List.of("输入", "填写", "填入", "写入", "设置"),
            "navigation", List.of("跳转", "打开", "访问", "转到", "页面"),
            "scroll", List.of("滚动", "翻页", "下拉", "上拉"),
            "select", List.of("选择", "选中", "勾选", "下拉")
    );

    private static final Map<String, List<String>> TAG_KEYWORDS = Map.of(
            "button", List.of("按钮", "点击", "确认", "提交"),
            "input", List.of("输入", "填写", "输入框"),
            "select", List.of("选择", "下拉", "选项"),
            "a", List.of("链接", "跳转", "打开")
    );

    public double similarity(BrowserEvent browserEvent, VoiceEvent voiceEvent) {
        String voiceText = voiceEvent.text() == null ? "" : voiceEvent.text().toLowerCase(Locale.ROOT);

        double similarity = ratio(TYPE_KEYWORDS.get(lower(browserEvent.type())), voiceText);

        if (browserEvent.elementTag() != null) {
            List<String> tagWords = TAG_KEYWORDS.get(lower(browserEvent.elementTag()));
            if (tagWords != null) {
                similarity = Math.max(similarity, ratio(tagWords, voiceText));
            }
        }

        return Math.min(similarity, 1.0);
    }

    private static double ratio(List<String> keywords, String text) {
        if (keywords == null || keywords.isEmpty()) {
            return 0.0;
        }
        long matches = keywords.stream().filter(text::contains).count();
        return (double) matches / keywords.size();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}

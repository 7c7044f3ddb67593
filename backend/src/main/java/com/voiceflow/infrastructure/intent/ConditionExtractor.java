package com.voiceflow.infrastructure.intent;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts conditional clauses and renders each as "if <antecedent> then <consequent>".
 * "unless" clauses negate the antecedent: "if not <antecedent> then <consequent>".
 *
 * Patterns run in order and every match is kept; the same clause matched by two
 * patterns appears twice.
 */
@Component
public class ConditionExtractor {

    // Each pattern captures (antecedent, consequent). Input is normalized, so clause breaks are ','.
    private static final List<Pattern> CONDITION_PATTERNS = List.of(
            compile("如果(.+?)就(.+?)(?:,|$)"),
            compile("当(.+?)时(.+?)(?:,|$)"),
            compile("假如(.+?)则(.+?)(?:,|$)"),
            compile("要是(.+?)就(.+?)(?:,|$)"),
            compile("(没有[^,]*?)就(.+?)(?:,|$)"),
            compile("([^,]*?为空)就(.+?)(?:,|$)"),
            compile("\\bif\\s+(.+?),?\\s*then\\s+(.+?)(?:,|$)"),
            compile("\\bwhen\\s+(.+?),\\s*(.+?)(?:,|$)")
    );

    private static final List<Pattern> UNLESS_PATTERNS = List.of(
            compile("除非(.+?)否则(.+?)(?:,|$)"),
            compile("\\bunless\\s+(.+?),\\s*(.+?)(?:,|$)")
    );

    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[\\s,]+|[\\s,]+$");

    public List<String> extract(String text) {
        List<String> conditions = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return conditions;
        }

        collect(text, CONDITION_PATTERNS, "if ", conditions);
        collect(text, UNLESS_PATTERNS, "if not ", conditions);
        return conditions;
    }

    private static void collect(String text, List<Pattern> patterns, String prefix, List<String> conditions) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String antecedent = clean(m.group(1));
                String consequent = clean(m.group(2));
                conditions.add(prefix + antecedent + " then " + consequent);
            }
        }
    }

    private static String clean(String part) {
        return EDGE_SEPARATORS.matcher(part).replaceAll("");
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}

package com.voiceflow.infrastructure.intent;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes an utterance before intent rules run:
 * - Trim and collapse whitespace runs to a single space
 * - Full-width sentence punctuation → ASCII comma (one comma per mark)
 * - Lower-case
 */
@Component
public class TranscriptNormalizer {

    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    // ，。！？；：
    private static final Pattern CLAUSE_PUNCTUATION = Pattern.compile("[，。！？；：]");

    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        // collapse before trimming: strip() does not treat NBSP as whitespace
        String result = WHITESPACE_RUNS.matcher(text).replaceAll(" ").strip();
        result = CLAUSE_PUNCTUATION.matcher(result).replaceAll(",");
        return result.toLowerCase(Locale.ROOT);
    }

    /**
     * Number of whitespace-separated tokens in normalized text.
     */
    public int wordCount(String normalized) {
        if (normalized == null || normalized.isBlank()) {
            return 0;
        }
        return normalized.strip().split(" ").length;
    }
}

package com.example.narrator.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Tokenising helpers shared by analysis, script budgeting and keyword alignment.
 */
public final class TextUtil {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

    private TextUtil() {
    }

    public static List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(text.trim()))
                .filter(token -> !token.isBlank())
                .toList();
    }

    public static int wordCount(String text) {
        return words(text).size();
    }

    /** Splits on sentence punctuation; the punctuation itself is dropped. */
    public static List<String> sentences(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String part : SENTENCE_END.split(text)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /** Lower-cased token with leading and trailing punctuation removed. */
    public static String normalizeToken(String token) {
        if (token == null) {
            return "";
        }
        return EDGE_PUNCTUATION.matcher(token.trim()).replaceAll("").toLowerCase(Locale.ROOT);
    }

    public static List<String> normalizedWords(String text) {
        return words(text).stream()
                .map(TextUtil::normalizeToken)
                .filter(token -> !token.isEmpty())
                .toList();
    }

    /**
     * Case-insensitive whole-word pattern: "plasma" matches "Plasma," but not "plasmatic".
     */
    public static Pattern wordBoundaryPattern(String keyword) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(keyword.trim()) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public static String truncate(String body, int max) {
        if (body == null) return "";
        if (body.length() <= max) return body;
        return body.substring(0, max) + "...";
    }
}

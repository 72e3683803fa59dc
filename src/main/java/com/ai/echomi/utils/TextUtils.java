package com.ai.echomi.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

public final class TextUtils {

    private static final Pattern MULTI_SPACE = Pattern.compile("\\s+");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{M}\\p{N}\\s\\-.,!?']");
    private static final Pattern SENTENCE_PUNCTUATION = Pattern.compile("[.!?]");

    private TextUtils() {
    }

    /**
     * Trims, collapses whitespace and drops symbols other than basic punctuation.
     */
    public static String clean(String text) {
        if (StringUtils.isBlank(text)) return "";
        String t = MULTI_SPACE.matcher(text.trim()).replaceAll(" ");
        return DISALLOWED.matcher(t).replaceAll("");
    }

    /** Lower-cased, trimmed, with {@code . ! ?} removed. */
    public static String normalizeForMatching(String text) {
        if (text == null) return "";
        return SENTENCE_PUNCTUATION.matcher(text.toLowerCase().trim()).replaceAll("").trim();
    }

    /**
     * "big basket" -> "Big Basket", "AMAZON" -> "Amazon".
     */
    public static String titleCase(String text) {
        if (StringUtils.isBlank(text)) return text;
        String[] words = MULTI_SPACE.split(text.trim());
        StringBuilder sb = new StringBuilder();
        for (String w : words) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(StringUtils.capitalize(w.toLowerCase()));
        }
        return sb.toString();
    }

    public static boolean containsAny(String haystack, Iterable<String> needles) {
        if (haystack == null) return false;
        for (String n : needles) {
            if (haystack.contains(n)) return true;
        }
        return false;
    }

    public static String nullIfEmpty(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}

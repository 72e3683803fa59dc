package com.ai.echomi.utils;

import com.ai.echomi.conversation.Language;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Guesses Hindi vs English for requests that arrive without a response language.
 */
public final class LanguageDetector {

    private static final Pattern DEVANAGARI = Pattern.compile("[\\u0900-\\u097F]");

    private static final List<String> ROMANIZED_HINDI = List.of(
            "hai", "hain", "aur", "kya", "kaise", "kahan", "kab", "kaun",
            "mere", "mera", "aapka", "aap", "hum", "namaste", "dhanyawad",
            "kripaya", "madat", "chahiye"
    );

    private LanguageDetector() {
    }

    public static Language detect(String text) {
        if (StringUtils.isBlank(text)) return Language.EN;
        if (DEVANAGARI.matcher(text).find()) return Language.HI;
        String lower = " " + text.toLowerCase().replaceAll("[^a-z\\s]", " ") + " ";
        int hits = 0;
        for (String word : ROMANIZED_HINDI) {
            if (lower.contains(" " + word + " ")) hits++;
        }
        return hits >= 2 ? Language.HI : Language.EN;
    }
}

package com.ai.echomi.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Indian-style phone number extraction and normalization.
 */
public final class PhoneNumbers {

    private static final Pattern GROUPED = Pattern.compile("\\(?(\\d{3})\\)?[-.\\s]*(\\d{3})[-.\\s]*(\\d{4})");

    private static final List<Pattern> SINGLE_GROUP = List.of(
            Pattern.compile("\\+?91[-.\\s]*(\\d{10})"),
            Pattern.compile("(\\d{10})"),
            Pattern.compile("(\\d{3}[-.\\s]*\\d{3}[-.\\s]*\\d{4})"),
            Pattern.compile("(\\d{4}[-.\\s]*\\d{3}[-.\\s]*\\d{3})"),
            Pattern.compile("(\\d{2}[-.\\s]*\\d{4}[-.\\s]*\\d{4})")
    );

    private static final Pattern NOT_DIGIT_OR_PLUS = Pattern.compile("[^\\d+]");

    private PhoneNumbers() {
    }

    /**
     * First phone-like run of at least ten digits, with separators removed. Returns
     * null when nothing qualifies.
     */
    public static String extract(String text) {
        if (StringUtils.isBlank(text)) return null;
        Matcher grouped = GROUPED.matcher(text);
        if (grouped.find()) {
            String candidate = grouped.group(1) + grouped.group(2) + grouped.group(3);
            if (candidate.length() >= 10) return candidate;
        }
        for (Pattern p : SINGLE_GROUP) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                String candidate = NOT_DIGIT_OR_PLUS.matcher(m.group(1)).replaceAll("");
                if (candidate.length() >= 10) return candidate;
            }
        }
        return null;
    }

    /**
     * 10 digits get a +91 prefix, 12 digits starting with 91 get a +; anything else
     * is returned as bare digits, or null when there are none.
     */
    public static String normalize(String raw) {
        if (raw == null) return null;
        String digits = raw.replaceAll("\\D", "");
        if (digits.length() == 10) return "+91" + digits;
        if (digits.length() == 12 && digits.startsWith("91")) return "+" + digits;
        return digits.isEmpty() ? null : digits;
    }

    /** Digits to read back to the caller: the national part of a +91 number. */
    public static String national(String phone) {
        if (phone == null) return "";
        String digits = phone.replaceAll("\\D", "");
        if (digits.length() == 12 && digits.startsWith("91")) return digits.substring(2);
        return digits;
    }
}

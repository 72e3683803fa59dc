package com.ai.echomi.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Digit handling for text that will be read out by a speech synthesizer, and the
 * reverse: digits spoken back by the caller.
 */
public final class SpeechFormat {

    private static final Pattern OTP_DIGITS = Pattern.compile("\\b(\\d{4,6})\\b");

    private static final Map<String, Character> SPOKEN_DIGITS = Map.ofEntries(
            Map.entry("zero", '0'), Map.entry("oh", '0'),
            Map.entry("one", '1'), Map.entry("two", '2'),
            Map.entry("three", '3'), Map.entry("four", '4'),
            Map.entry("five", '5'), Map.entry("six", '6'),
            Map.entry("seven", '7'), Map.entry("eight", '8'),
            Map.entry("nine", '9'),
            Map.entry("शून्य", '0'), Map.entry("एक", '1'), Map.entry("दो", '2'),
            Map.entry("तीन", '3'), Map.entry("चार", '4'), Map.entry("पांच", '5'),
            Map.entry("पाँच", '5'), Map.entry("छह", '6'), Map.entry("सात", '7'),
            Map.entry("आठ", '8'), Map.entry("नौ", '9')
    );

    private SpeechFormat() {
    }

    /** "4821" -> "4 8 2 1"; anything that is not a digit is dropped. */
    public static String spaceDigits(String value) {
        if (StringUtils.isEmpty(value)) return "";
        StringBuilder sb = new StringBuilder();
        for (char c : value.toCharArray()) {
            if (Character.isDigit(c)) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Finds an OTP in what the caller said: a 4-6 digit group first, then a run of
     * spoken digit words ("four eight two one"), then loose single digits.
     */
    public static String parseSpokenOtp(String utterance) {
        if (StringUtils.isBlank(utterance)) return null;
        Matcher m = OTP_DIGITS.matcher(utterance);
        if (m.find()) {
            return m.group(1);
        }
        StringBuilder digits = new StringBuilder();
        for (String token : utterance.toLowerCase().split("[\\s,.-]+")) {
            Character d = SPOKEN_DIGITS.get(token);
            if (d != null) {
                digits.append(d);
            } else if (token.matches("\\d+")) {
                digits.append(token);
            }
        }
        int len = digits.length();
        return len >= 4 && len <= 6 ? digits.toString() : null;
    }
}

package com.ai.echomi.service;

import com.ai.echomi.conversation.YesNoResult;
import com.ai.echomi.utils.TextUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies answers to yes/no questions, in English and Hindi.
 */
@Service
public class YesNoClassifier {

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "yes", "yeah", "yep", "ya", "yup", "ok", "okay", "sure", "correct", "right",
            "absolutely", "definitely", "confirm", "हाँ", "हां", "जी", "हाँ जी", "हां जी", "ठीक है", "सही"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "no", "nope", "nah", "not really", "ना", "नहीं", "नहीं चाहिए"
    );

    /** Checked before anything else: "don't need" must not be read as "need". */
    private static final Pattern NEGATIVE_PHRASE = Pattern.compile(
            "\\b(don't need|dont need|not needed|no need|no thanks)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern AFFIRMATIVE_PATTERN = Pattern.compile(
            "\\b(yes|yeah|yep|ya|yup|ok|okay|sure|correct|right|confirm|absolutely|definitely|need)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NEGATIVE_PATTERN = Pattern.compile(
            "\\b(no|nope|nah|don't|dont|not now|wrong)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final List<String> AFFIRMATIVE_HINDI = List.of("हाँ", "हां", "चाहिए", "सही", "ठीक");

    private static final String NEGATIVE_HINDI = "नहीं";

    public YesNoResult classify(String userInput) {
        if (userInput == null || userInput.isBlank()) {
            return YesNoResult.UNKNOWN;
        }
        String normalized = TextUtils.normalizeForMatching(userInput);

        if (normalized.length() <= 15) {
            if (AFFIRMATIVE_EXACT.contains(normalized)) {
                return YesNoResult.YES;
            }
            if (NEGATIVE_EXACT.contains(normalized)) {
                return YesNoResult.NO;
            }
        }
        if (NEGATIVE_PHRASE.matcher(normalized).find() || normalized.contains(NEGATIVE_HINDI)) {
            return YesNoResult.NO;
        }

        boolean affirmative = AFFIRMATIVE_PATTERN.matcher(normalized).find()
                || TextUtils.containsAny(normalized, AFFIRMATIVE_HINDI);
        boolean negative = NEGATIVE_PATTERN.matcher(normalized).find();
        if (affirmative && negative) {
            return YesNoResult.UNKNOWN;
        }
        if (affirmative) {
            return YesNoResult.YES;
        }
        if (negative) {
            return YesNoResult.NO;
        }
        return YesNoResult.UNKNOWN;
    }

    public boolean isAffirmative(String userInput) {
        return classify(userInput) == YesNoResult.YES;
    }

    public boolean isNegative(String userInput) {
        return classify(userInput) == YesNoResult.NO;
    }
}

package com.ai.echomi.service;

import com.ai.echomi.conversation.CallerRole;
import com.ai.echomi.conversation.Intent;
import com.ai.echomi.utils.TextUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tags an utterance with a single intent. Checks run in a fixed order and the
 * first one that matches wins, so OTP requests beat everything else.
 */
@Service
public class IntentClassifier {

    private static final Pattern OTP_REQUEST = Pattern.compile(
            "\\b(otp|one time password|code|verification code|pin|security code|auth code|login code)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final List<String> OTP_REQUEST_HINDI = List.of(
            "ओटीपी", "कोड चाहिए", "otp चाहिए", "चाहिए otp"
    );

    private static final Pattern COMPANY_WORD = Pattern.compile(
            "\\b(amazon|flipkart|myntra|zomato|swiggy|delivery|zepto|bluedart)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final List<String> COMPANY_WORD_HINDI = List.of("का", "से");

    private static final List<String> OTP_ADJACENT = List.of("code", "otp", "pin", "चाहिए", "कोड");

    private static final Pattern LOCATION = Pattern.compile(
            "\\b(road|nagar|colony|market|station|gate|circle|apartment|complex|mall|near|opposite|metro|bus stop)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern DELIVERY = Pattern.compile(
            "\\b(delivery|parcel|package|amazon|flipkart|swiggy|zomato|zepto)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final List<String> NON_URGENT_CALLBACK = List.of(
            "it's fine", "it's ok", "ask him to call", "just call me back"
    );

    private static final List<String> SELF_NUMBER = List.of(
            "same number", "this number", "number i'm calling from"
    );

    private static final List<String> CALLBACK = List.of("call back", "callback", "call me back");

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of("yes", "yeah", "yep", "ok", "okay", "sure", "correct");

    private static final Set<String> NEGATIVE_EXACT = Set.of("no", "nope", "not really");

    private static final List<String> ENDING = List.of("thank", "bye");

    /** Wider than the delivery intent: used once, to decide which stage graph a new caller enters. */
    private static final Pattern DELIVERY_ROLE = Pattern.compile(
            "\\b(delivery|parcel|package|amazon|flipkart|swiggy|zomato|zepto|bluedart|myntra|courier|order|shipped)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern URGENT = Pattern.compile("\\b(urgent|asap|emergency)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<String> URGENT_HINDI = List.of("जरूरी", "तुरंत");

    public Intent classify(String userText) {
        if (userText == null || userText.isBlank()) return Intent.GENERAL;
        String lower = userText.toLowerCase().trim();
        String cleaned = TextUtils.normalizeForMatching(userText);

        if (isOtpRequest(lower)) {
            return Intent.REQUESTING_OTP;
        }
        boolean mentionsCompany = COMPANY_WORD.matcher(lower).find() || TextUtils.containsAny(lower, COMPANY_WORD_HINDI);
        if (mentionsCompany && TextUtils.containsAny(lower, OTP_ADJACENT)) {
            return Intent.REQUESTING_OTP;
        }
        if (LOCATION.matcher(lower).find()) {
            return Intent.PROVIDING_LOCATION;
        }
        if (DELIVERY.matcher(lower).find()) {
            return Intent.INITIAL_DELIVERY;
        }
        if (TextUtils.containsAny(lower, NON_URGENT_CALLBACK)) {
            return Intent.NON_URGENT_CALLBACK;
        }
        if (TextUtils.containsAny(lower, SELF_NUMBER)) {
            return Intent.PROVIDE_SELF_NUMBER;
        }
        if (TextUtils.containsAny(lower, CALLBACK)) {
            return Intent.REQUESTING_CALLBACK;
        }
        if (AFFIRMATIVE_EXACT.contains(cleaned)) {
            return Intent.GENERAL_YES;
        }
        if (NEGATIVE_EXACT.contains(cleaned)) {
            return Intent.DECLINING;
        }
        if (TextUtils.containsAny(lower, ENDING)) {
            return Intent.ENDING_CONVERSATION;
        }
        return Intent.GENERAL;
    }

    public boolean isOtpRequest(String userText) {
        if (userText == null) return false;
        String lower = userText.toLowerCase();
        return OTP_REQUEST.matcher(lower).find() || TextUtils.containsAny(lower, OTP_REQUEST_HINDI);
    }

    public boolean isDeliveryMention(String userText) {
        return userText != null && DELIVERY_ROLE.matcher(userText).find();
    }

    public boolean isUrgent(String userText) {
        if (userText == null) return false;
        return URGENT.matcher(userText).find() || TextUtils.containsAny(userText, URGENT_HINDI);
    }

    /**
     * Decides which stage graph a caller with no role yet belongs to.
     */
    public CallerRole identifyRole(String userText) {
        return isDeliveryMention(userText) ? CallerRole.DELIVERY : CallerRole.UNKNOWN;
    }
}

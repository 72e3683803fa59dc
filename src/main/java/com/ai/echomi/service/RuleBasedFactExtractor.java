package com.ai.echomi.service;

import com.ai.echomi.dto.ExtractedFacts;
import com.ai.echomi.utils.PhoneNumbers;
import com.ai.echomi.utils.TextUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-only fact extraction, used whenever the language model is missing or
 * gives an unusable answer.
 */
@Component
public class RuleBasedFactExtractor {

    private static final List<String> COMPANIES = List.of(
            "amazon", "flipkart", "swiggy", "zomato", "dunzo", "zepto", "bluedart", "myntra", "bigbasket"
    );

    /** Canonical company -> spellings and sender-style abbreviations heard on calls. */
    private static final Map<String, List<String>> COMPANY_ALIASES = new LinkedHashMap<>();

    static {
        COMPANY_ALIASES.put("zomato", List.of("zomato", "zmt"));
        COMPANY_ALIASES.put("swiggy", List.of("swiggy", "swg"));
        COMPANY_ALIASES.put("amazon", List.of("amazon", "amzn", "amz"));
        COMPANY_ALIASES.put("flipkart", List.of("flipkart", "fkrt", "fk"));
        COMPANY_ALIASES.put("bigbasket", List.of("bigbasket", "big basket", "bb"));
        COMPANY_ALIASES.put("dunzo", List.of("dunzo"));
        COMPANY_ALIASES.put("myntra", List.of("myntra"));
        COMPANY_ALIASES.put("bluedart", List.of("bluedart", "blue dart"));
        COMPANY_ALIASES.put("delhivery", List.of("delhivery"));
        COMPANY_ALIASES.put("fedex", List.of("fedex"));
        COMPANY_ALIASES.put("zepto", List.of("zepto"));
        COMPANY_ALIASES.put("blinkit", List.of("blinkit"));
    }

    private static final List<Pattern> SELF_INTRODUCTION = List.of(
            Pattern.compile("my name is\\s+([a-z]+(?:\\s+[a-z]+){0,3})"),
            Pattern.compile("\\bi am\\s+([a-z]+(?:\\s+[a-z]+){0,3})"),
            Pattern.compile("\\bthis is\\s+([a-z]+(?:\\s+[a-z]+){0,3})"),
            Pattern.compile("\\bi'm\\s+([a-z]+(?:\\s+[a-z]+){0,3})")
    );

    private static final Pattern SPELLED_OUT = Pattern.compile("\\b([a-z](?:\\s+[a-z]){2,4})\\b");

    private static final List<Pattern> AFTER_IS = List.of(
            Pattern.compile("name is\\s+([^\\s,]+)"),
            Pattern.compile("\\bis\\s+([^\\s,.]+)")
    );

    /** A self-introduction stops at the first of these words. */
    private static final Set<String> NAME_TERMINATORS = Set.of(
            "and", "from", "calling", "here", "speaking", "with", "to", "for", "i", "regarding", "about"
    );

    private static final Set<String> REJECTED_NAMES = Set.of("calling", "talking", "speaking", "here", "you", "me");

    private static final Set<String> NON_NAME_WORDS = Set.of(
            "my", "name", "is", "this", "i", "am", "the", "a", "an",
            "hello", "hi", "hey", "yes", "no", "ok", "okay", "what", "sorry", "um", "uh", "hmm",
            "have", "has", "got", "need", "want", "just", "delivery", "parcel", "package", "order", "sir", "madam"
    );

    /** A lone word is taken as a name only from short answers like "Priya" or "Rahul here". */
    private static final int MAX_BARE_ANSWER_WORDS = 3;

    public ExtractedFacts extract(String utterance) {
        if (StringUtils.isBlank(utterance)) {
            return ExtractedFacts.empty();
        }
        ExtractedFacts facts = new ExtractedFacts();
        facts.setCompany(findCompany(utterance).orElse(null));
        facts.setName(findName(utterance));
        String phone = PhoneNumbers.extract(utterance);
        facts.setPhone(phone == null ? null : PhoneNumbers.normalize(phone));
        return facts;
    }

    public Optional<String> findCompany(String utterance) {
        String lower = utterance.toLowerCase();
        for (String company : COMPANIES) {
            if (lower.contains(company)) {
                return Optional.of(TextUtils.titleCase(company));
            }
        }
        return Optional.empty();
    }

    /**
     * Answer to "which company?": a known company or alias, otherwise whatever the
     * caller said, title-cased.
     */
    public String companyFromAnswer(String utterance) {
        String lower = utterance == null ? "" : utterance.toLowerCase();
        for (Map.Entry<String, List<String>> e : COMPANY_ALIASES.entrySet()) {
            for (String alias : e.getValue()) {
                if (Pattern.compile("\\b" + Pattern.quote(alias) + "\\b").matcher(lower).find()) {
                    return TextUtils.titleCase(e.getKey());
                }
            }
        }
        String cleaned = TextUtils.clean(utterance).replaceAll("[.,!?]", "").trim();
        return StringUtils.isBlank(cleaned) ? null : TextUtils.titleCase(cleaned);
    }

    String findName(String utterance) {
        String lower = utterance.toLowerCase().trim();

        for (Pattern p : SELF_INTRODUCTION) {
            Matcher m = p.matcher(lower);
            if (m.find()) {
                String candidate = acceptable(joinSpelledLetters(cutAtTerminator(m.group(1))));
                if (candidate != null) return candidate;
            }
        }
        Matcher spelled = SPELLED_OUT.matcher(lower);
        if (spelled.find()) {
            String candidate = acceptable(joinSpelledLetters(spelled.group(1)));
            if (candidate != null) return candidate;
        }
        for (Pattern p : AFTER_IS) {
            Matcher m = p.matcher(lower);
            if (m.find()) {
                String candidate = acceptable(m.group(1));
                if (candidate != null) return candidate;
            }
        }
        String[] words = utterance.trim().split("\\s+");
        if (words.length > MAX_BARE_ANSWER_WORDS) {
            return null;
        }
        for (String word : words) {
            String token = StringUtils.strip(word, ".,!?");
            String lowerToken = token.toLowerCase();
            if (token.length() > 1 && token.length() < 15
                    && !NON_NAME_WORDS.contains(lowerToken)
                    && !REJECTED_NAMES.contains(lowerToken)
                    && !NAME_TERMINATORS.contains(lowerToken)
                    && token.chars().allMatch(Character::isLetter)) {
                return TextUtils.titleCase(token);
            }
        }
        return null;
    }

    private static String cutAtTerminator(String phrase) {
        StringBuilder kept = new StringBuilder();
        for (String word : phrase.trim().split("\\s+")) {
            if (NAME_TERMINATORS.contains(word)) break;
            if (kept.length() > 0) kept.append(' ');
            kept.append(word);
        }
        return kept.toString();
    }

    /** "r u d r a" -> "rudra"; anything else is returned unchanged. */
    private static String joinSpelledLetters(String phrase) {
        String[] parts = phrase.trim().split("\\s+");
        if (parts.length > 2) {
            boolean allLetters = true;
            for (String part : parts) {
                if (part.length() != 1 || !Character.isLetter(part.charAt(0))) {
                    allLetters = false;
                    break;
                }
            }
            if (allLetters) return String.join("", parts);
        }
        return phrase.trim();
    }

    private static String acceptable(String candidate) {
        if (candidate == null) return null;
        String c = StringUtils.strip(candidate.trim(), ".,!?");
        if (c.length() > 1 && c.length() < 20 && !REJECTED_NAMES.contains(c) && !NON_NAME_WORDS.contains(c)) {
            return TextUtils.titleCase(c);
        }
        return null;
    }
}

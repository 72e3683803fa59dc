package com.ai.echomi.service;

import com.ai.echomi.dto.OtpMatch;
import com.ai.echomi.dto.ParsedMessage;
import com.ai.echomi.dto.SmsMessageDto;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls OTPs and tracking ids out of delivery SMS bodies and picks the message
 * that most likely belongs to a given company.
 *
 * <p>Known companies get their own patterns; everything else goes through a
 * generic cascade where each rule carries a fixed confidence. Tracking-id
 * character classes are case-sensitive so that ordinary words ("delivery") are
 * never taken for ids.
 */
@Service
public class OtpExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(OtpExtractionEngine.class);

    static final double BASE_COMPANY_CONFIDENCE = 0.5;
    static final double INDICATOR_BOOST = 0.3;
    static final double OTP_BOOST = 0.2;
    static final double TRACKING_BOOST = 0.2;

    private static final Map<String, CompanySmsPattern> COMPANY_PATTERNS = new LinkedHashMap<>();

    static {
        COMPANY_PATTERNS.put("zomato", new CompanySmsPattern(
                "(?i:otp|code|password).*?(?<!\\d)(\\d{4,6})(?!\\d)",
                "(?i:order|tracking).*?([A-Z0-9]{8,})",
                List.of("zomato", "zmt")));
        COMPANY_PATTERNS.put("swiggy", new CompanySmsPattern(
                "(?i:otp|code|verification).*?(?<!\\d)(\\d{4,6})(?!\\d)",
                "(?i:order|track).*?([A-Z0-9]{8,})",
                List.of("swiggy", "swg")));
        COMPANY_PATTERNS.put("amazon", new CompanySmsPattern(
                "(?i:otp|code|pin).*?(?<!\\d)(\\d{4,6})(?!\\d)",
                "(?i:tracking|order).*?([A-Z0-9]{10,})",
                List.of("amazon", "amzn")));
        COMPANY_PATTERNS.put("flipkart", new CompanySmsPattern(
                "(?i:otp|code|verification).*?(?<!\\d)(\\d{4,6})(?!\\d)",
                "(?i:order|tracking).*?([A-Z0-9]{8,})",
                List.of("flipkart", "fkrt")));
        COMPANY_PATTERNS.put("bigbasket", new CompanySmsPattern(
                "(?i:otp|code).*?(?<!\\d)(\\d{4,6})(?!\\d)",
                "(?i:order|delivery).*?([A-Z0-9]{8,})",
                List.of("bigbasket", "bb")));
        COMPANY_PATTERNS.put("dunzo", new CompanySmsPattern(
                "(?i:otp|code).*?(?<!\\d)(\\d{4,6})(?!\\d)",
                "(?i:task|order).*?([A-Z0-9]{8,})",
                List.of("dunzo")));
    }

    private static final List<GenericRule> GENERIC_OTP_RULES = List.of(
            new GenericRule(Pattern.compile("\\b(\\d{4})\\b"), 0.6),
            new GenericRule(Pattern.compile("\\b(\\d{6})\\b"), 0.7),
            new GenericRule(Pattern.compile("(?:OTP|code|verification|pin).*?(?<!\\d)(\\d{4,6})(?!\\d)", Pattern.CASE_INSENSITIVE), 0.8)
    );

    private static final List<GenericRule> GENERIC_TRACKING_RULES = List.of(
            new GenericRule(Pattern.compile("\\b([A-Z]{2,4}\\d{8,12})\\b"), 0.7),
            new GenericRule(Pattern.compile("\\b(?=[A-Z0-9]*[A-Z])(?=[A-Z0-9]*\\d)([A-Z0-9]{8,15})\\b"), 0.5)
    );

    private static final Map<String, List<String>> SENDER_PREFIXES = new LinkedHashMap<>();

    static {
        SENDER_PREFIXES.put("zomato", List.of("zomato", "zmt", "zm-"));
        SENDER_PREFIXES.put("swiggy", List.of("swiggy", "swg", "sg-"));
        SENDER_PREFIXES.put("amazon", List.of("amazon", "amzn", "az-"));
        SENDER_PREFIXES.put("flipkart", List.of("flipkart", "fkrt", "fk-"));
        SENDER_PREFIXES.put("bigbasket", List.of("bigbasket", "bb-", "bigb"));
        SENDER_PREFIXES.put("dunzo", List.of("dunzo", "dz-"));
    }

    static final String UNKNOWN_COMPANY = "unknown";

    /**
     * Parses one SMS body: expected company's patterns first, then the company
     * detected from the text, then the generic cascade.
     */
    public ParsedMessage parse(String rawText, String expectedCompany) {
        String text = rawText == null ? "" : rawText;
        Optional<String> detected = detectCompany(text);
        if (StringUtils.isNotBlank(expectedCompany)) {
            String expected = expectedCompany.trim().toLowerCase();
            // a message that names a different company is not parsed as the expected one
            boolean namesOther = detected.isPresent() && !detected.get().equals(expected) && !mentionsCompany(text, expected);
            if (!namesOther) {
                Optional<ParsedMessage> byExpected = parseWithCompany(text, expected);
                if (byExpected.isPresent()) {
                    return byExpected.get();
                }
            }
        }
        if (detected.isPresent()) {
            Optional<ParsedMessage> byDetected = parseWithCompany(text, detected.get());
            if (byDetected.isPresent()) {
                return byDetected.get();
            }
        }
        return parseGeneric(text);
    }

    /**
     * Parses a forwarded SMS and falls back to the sender id when the body does
     * not reveal the company.
     */
    public ParsedMessage parse(SmsMessageDto sms, String expectedCompany) {
        String senderCompany = detectCompanyFromSender(sms.getSender());
        String expected = expectedCompany;
        if (!UNKNOWN_COMPANY.equals(senderCompany) && expectedCompany != null
                && !senderCompany.equalsIgnoreCase(expectedCompany.trim())) {
            expected = senderCompany;
        }
        ParsedMessage parsed = parse(sms.getMessage(), expected);
        String company = parsed.getCompany() != null ? parsed.getCompany() : senderCompany;
        return parsed.toBuilder()
                .sender(StringUtils.defaultString(sms.getSender()))
                .timestamp(sms.getTimestamp())
                .company(company)
                .build();
    }

    public Optional<String> detectCompany(String text) {
        if (text == null) return Optional.empty();
        String lower = text.toLowerCase();
        for (Map.Entry<String, CompanySmsPattern> e : COMPANY_PATTERNS.entrySet()) {
            for (String indicator : e.getValue().indicators) {
                if (lower.contains(indicator)) {
                    return Optional.of(e.getKey());
                }
            }
        }
        return Optional.empty();
    }

    private static boolean mentionsCompany(String text, String company) {
        CompanySmsPattern pattern = COMPANY_PATTERNS.get(company);
        String lower = text.toLowerCase();
        return pattern != null && pattern.indicators.stream().anyMatch(lower::contains);
    }

    public String detectCompanyFromSender(String sender) {
        if (StringUtils.isBlank(sender)) return UNKNOWN_COMPANY;
        String lower = sender.toLowerCase();
        for (Map.Entry<String, List<String>> e : SENDER_PREFIXES.entrySet()) {
            for (String prefix : e.getValue()) {
                if (lower.contains(prefix)) {
                    return e.getKey();
                }
            }
        }
        return UNKNOWN_COMPANY;
    }

    Optional<ParsedMessage> parseWithCompany(String text, String company) {
        CompanySmsPattern pattern = COMPANY_PATTERNS.get(company);
        if (pattern == null) {
            return Optional.empty();
        }
        String lower = text.toLowerCase();
        double confidence = BASE_COMPANY_CONFIDENCE;
        if (pattern.indicators.stream().anyMatch(lower::contains)) {
            confidence += INDICATOR_BOOST;
        }
        String otp = null;
        Matcher otpMatcher = pattern.otp.matcher(text);
        if (otpMatcher.find()) {
            otp = otpMatcher.group(1);
            confidence += OTP_BOOST;
        }
        String tracking = null;
        Matcher trackingMatcher = pattern.tracking.matcher(text);
        if (trackingMatcher.find()) {
            tracking = trackingMatcher.group(1);
            confidence += TRACKING_BOOST;
        }
        if (otp == null && tracking == null) {
            return Optional.empty();
        }
        confidence = Math.min(confidence, 1.0);

        if (otp != null) {
            ParsedMessage generic = parseGeneric(text);
            if (otp.equals(generic.getOtp()) && generic.getConfidence() > confidence) {
                confidence = generic.getConfidence();
            }
        }
        return Optional.of(ParsedMessage.builder()
                .rawText(text)
                .otp(otp)
                .trackingId(tracking)
                .company(company)
                .confidence(confidence)
                .build());
    }

    ParsedMessage parseGeneric(String text) {
        String otp = null;
        double bestOtp = 0;
        for (GenericRule rule : GENERIC_OTP_RULES) {
            Matcher m = rule.pattern.matcher(text);
            if (m.find() && rule.confidence > bestOtp) {
                otp = m.group(1);
                bestOtp = rule.confidence;
            }
        }
        String tracking = null;
        double bestTracking = 0;
        for (GenericRule rule : GENERIC_TRACKING_RULES) {
            Matcher m = rule.pattern.matcher(text);
            if (m.find() && rule.confidence > bestTracking) {
                tracking = m.group(1);
                bestTracking = rule.confidence;
            }
        }
        return ParsedMessage.builder()
                .rawText(text)
                .otp(otp)
                .trackingId(tracking)
                .confidence(Math.max(bestOtp, bestTracking))
                .build();
    }

    /**
     * Scores every OTP-bearing candidate against the target company and returns
     * the highest one; on equal scores the earlier message wins. When no candidate
     * has any company evidence the most confident OTP is returned with
     * {@code fallbackUsed} set.
     */
    public Optional<OtpMatch> findBestMatch(List<ParsedMessage> candidates, String targetCompany) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        String target = StringUtils.defaultString(targetCompany).trim().toLowerCase();

        ParsedMessage best = null;
        double bestScore = 0;
        boolean bestHasEvidence = false;
        ParsedMessage mostConfident = null;

        for (int i = 0; i < candidates.size(); i++) {
            ParsedMessage candidate = candidates.get(i);
            if (!candidate.hasOtp()) {
                continue;
            }
            if (mostConfident == null || candidate.getConfidence() > mostConfident.getConfidence()) {
                mostConfident = candidate;
            }

            double evidence = companyEvidence(candidate, target);
            double score = evidence + candidate.getConfidence() * 10;
            if (i == 0) {
                score += 5;
            }
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
                bestHasEvidence = evidence > 0;
            }
        }

        if (best != null) {
            log.debug("Best OTP match from '{}' score={} evidence={}", best.getSender(), bestScore, bestHasEvidence);
            return Optional.of(new OtpMatch(best, bestScore, !bestHasEvidence));
        }
        if (mostConfident != null) {
            return Optional.of(new OtpMatch(mostConfident, 0, true));
        }
        return Optional.empty();
    }

    private static double companyEvidence(ParsedMessage candidate, String target) {
        if (target.isEmpty()) {
            return 0;
        }
        double score = 0;
        String detected = StringUtils.defaultString(candidate.getCompany()).toLowerCase();
        if (!detected.isEmpty() && !UNKNOWN_COMPANY.equals(detected)
                && (detected.contains(target) || target.contains(detected))) {
            score += 50;
        }
        if (StringUtils.defaultString(candidate.getSender()).toLowerCase().contains(target)) {
            score += 40;
        }
        if (StringUtils.defaultString(candidate.getRawText()).toLowerCase().contains(target)) {
            score += 20;
        }
        return score;
    }

    private static final class CompanySmsPattern {
        private final Pattern otp;
        private final Pattern tracking;
        private final List<String> indicators;

        private CompanySmsPattern(String otpRegex, String trackingRegex, List<String> indicators) {
            this.otp = Pattern.compile(otpRegex);
            this.tracking = Pattern.compile(trackingRegex);
            this.indicators = indicators;
        }
    }

    private static final class GenericRule {
        private final Pattern pattern;
        private final double confidence;

        private GenericRule(Pattern pattern, double confidence) {
            this.pattern = pattern;
            this.confidence = confidence;
        }
    }
}

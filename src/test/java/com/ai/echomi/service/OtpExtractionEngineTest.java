package com.ai.echomi.service;

import com.ai.echomi.dto.OtpMatch;
import com.ai.echomi.dto.ParsedMessage;
import com.ai.echomi.dto.SmsMessageDto;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OtpExtractionEngineTest {

    private final OtpExtractionEngine engine = new OtpExtractionEngine();

    @Test
    void shouldParseCompanyMessageWithFullConfidence() {
        ParsedMessage parsed = engine.parse("Your Zomato OTP is 4821", "Zomato");

        assertEquals("4821", parsed.getOtp());
        assertEquals("zomato", parsed.getCompany());
        assertEquals(1.0, parsed.getConfidence(), 1e-9);
    }

    @Test
    void shouldExtractTrackingIdFromSenderMatchedMessage() {
        SmsMessageDto sms = new SmsMessageDto("VM-SWIGGY", "Your Swiggy order OTP is 4821. Order ID SWG12345678", null);

        ParsedMessage parsed = engine.parse(sms, "Swiggy");

        assertEquals("4821", parsed.getOtp());
        assertEquals("SWG12345678", parsed.getTrackingId());
        assertEquals("VM-SWIGGY", parsed.getSender());
        assertTrue(parsed.getConfidence() <= 1.0);
    }

    @Test
    void shouldRaiseCompanyConfidenceToGenericFloorWhenSameOtp() {
        ParsedMessage parsed = engine.parse("OTP 4821 for order", "swiggy");

        assertEquals("4821", parsed.getOtp());
        assertEquals("swiggy", parsed.getCompany());
        assertEquals(0.8, parsed.getConfidence(), 1e-9);
    }

    @Test
    void shouldFallBackToGenericRulesWithoutCompany() {
        ParsedMessage parsed = engine.parse("Use 123456 to log in", null);

        assertEquals("123456", parsed.getOtp());
        assertNull(parsed.getCompany());
        assertEquals(0.7, parsed.getConfidence(), 1e-9);
    }

    @Test
    void shouldSkipLongerOrderNumberBeforeOtp() {
        ParsedMessage parsed = engine.parse("Zomato: OTP for order 12345678 is 4821", "zomato");

        assertEquals("4821", parsed.getOtp());
        assertEquals("12345678", parsed.getTrackingId());
    }

    @Test
    void shouldNotCutOtpOutOfLongerNumber() {
        ParsedMessage parsed = engine.parse("Your Zomato OTP is 12345678", "zomato");

        assertNull(parsed.getOtp());
    }

    @Test
    void shouldSkipLongerNumberInGenericKeywordRule() {
        ParsedMessage parsed = engine.parse("Verification for account 9876543210 code 5521", null);

        assertEquals("5521", parsed.getOtp());
    }

    @Test
    void shouldNotTakeLowercaseWordsForTrackingIds() {
        ParsedMessage parsed = engine.parse("Your delivery otp is 4821", null);

        assertEquals("4821", parsed.getOtp());
        assertNull(parsed.getTrackingId());
    }

    @Test
    void shouldNotParseMessageNamingAnotherCompanyAsExpectedOne() {
        ParsedMessage parsed = engine.parse("Your Swiggy OTP is 1111", "zomato");

        assertEquals("swiggy", parsed.getCompany());
        assertEquals("1111", parsed.getOtp());
    }

    @Test
    void shouldDetectCompanyFromSenderId() {
        assertEquals("amazon", engine.detectCompanyFromSender("AX-AMZNIN"));
        assertEquals(OtpExtractionEngine.UNKNOWN_COMPANY, engine.detectCompanyFromSender("VK-BANK"));
        assertEquals(OtpExtractionEngine.UNKNOWN_COMPANY, engine.detectCompanyFromSender(null));
    }

    @Test
    void shouldKeepConfidenceWithinUnitInterval() {
        List<String> bodies = List.of(
                "Amazon pin 123456 tracking AMZ1234567890",
                "Flipkart verification code 5555 order FKRT12345678",
                "hello there",
                "4821"
        );
        for (String body : bodies) {
            double confidence = engine.parse(body, "amazon").getConfidence();
            assertTrue(confidence >= 0.0 && confidence <= 1.0, body);
        }
    }

    @Test
    void shouldPreferCompanyEvidenceOverEarlierPosition() {
        ParsedMessage bank = message("VK-BANK", "Your bank OTP is 9999", null, 0.8);
        ParsedMessage zomato = message("VM-ZOMATO", "Your Zomato OTP is 4821", "zomato", 1.0);

        Optional<OtpMatch> match = engine.findBestMatch(List.of(bank, zomato), "Zomato");

        assertTrue(match.isPresent());
        assertSame(zomato, match.get().getMessage());
        assertFalse(match.get().isFallbackUsed());
    }

    @Test
    void shouldFlagFallbackWhenNoCandidateMentionsTarget() {
        ParsedMessage bank = message("VK-BANK", "Your bank OTP is 9999", null, 0.8);
        ParsedMessage other = message("VK-SHOP", "Code 1234", null, 0.6);

        OtpMatch match = engine.findBestMatch(List.of(other, bank), "Zomato").orElseThrow();

        assertTrue(match.isFallbackUsed());
        assertFalse(match.getMessage().getOtp().isEmpty());
    }

    @Test
    void shouldBreakTiesInFavourOfEarlierMessage() {
        ParsedMessage first = message("VM-ZOMATO", "Zomato OTP 1111", "zomato", 1.0);
        ParsedMessage second = message("VM-ZOMATO", "Zomato OTP 2222", "zomato", 1.0);

        OtpMatch match = engine.findBestMatch(List.of(first, second), "zomato").orElseThrow();

        assertEquals("1111", match.getMessage().getOtp());
    }

    @Test
    void shouldReturnEmptyWhenNoCandidateHasOtp() {
        ParsedMessage noOtp = message("VM-ZOMATO", "Your order is on the way", "zomato", 0.5);

        assertTrue(engine.findBestMatch(List.of(noOtp), "zomato").isEmpty());
        assertTrue(engine.findBestMatch(List.of(), "zomato").isEmpty());
    }

    private static ParsedMessage message(String sender, String text, String company, double confidence) {
        String otp = text.replaceAll("\\D", "");
        return ParsedMessage.builder()
                .sender(sender)
                .rawText(text)
                .otp(otp.isEmpty() ? null : otp)
                .company(company)
                .confidence(confidence)
                .build();
    }
}

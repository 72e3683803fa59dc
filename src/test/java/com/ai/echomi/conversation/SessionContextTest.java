package com.ai.echomi.conversation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionContextTest {

    private SessionContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new SessionContext("CA1", "+919876543210", CallerRole.UNKNOWN, UnknownStage.ASKING_NAME, null);
    }

    @Test
    void shouldDefaultToEnglishWhenLanguageMissing() {
        assertEquals(Language.EN, ctx.getLanguage());
    }

    @Test
    void shouldKeepFirstValueWhenPutIfAbsent() {
        ctx.putIfAbsent(FactKeys.NAME, "Rudra");
        ctx.putIfAbsent(FactKeys.NAME, "Someone Else");

        assertEquals("Rudra", ctx.getString(FactKeys.NAME));
    }

    @Test
    void shouldTreatBlankFactAsAbsent() {
        ctx.putAll(Map.of(FactKeys.PURPOSE, "  "));

        assertFalse(ctx.has(FactKeys.PURPOSE));
        ctx.putIfAbsent(FactKeys.PURPOSE, "sponsorship");
        assertEquals("sponsorship", ctx.getString(FactKeys.PURPOSE));
    }

    @Test
    void shouldReadCountersSentBackAsStrings() {
        ctx.putAll(Map.of(FactKeys.NAME_ATTEMPTS, "2", FactKeys.LOCATION_ATTEMPTS, "two"));

        assertEquals(2, ctx.getInt(FactKeys.NAME_ATTEMPTS));
        assertEquals(0, ctx.getInt(FactKeys.LOCATION_ATTEMPTS));
        assertEquals(0, ctx.getInt(FactKeys.FOLLOWUP_ASKED));
    }

    @Test
    void shouldRejectStageFromOtherGraph() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ctx.setStage(DeliveryStage.CHECKING_SMS));

        assertTrue(ex.getMessage().contains("checking_sms"));
        assertEquals(UnknownStage.ASKING_NAME, ctx.getStage());
    }

    @Test
    void shouldSwitchRoleWhenHandedOver() {
        ctx.handOver(DeliveryStage.CHECKING_SMS);

        assertEquals(CallerRole.DELIVERY, ctx.getCallerRole());
        assertEquals(DeliveryStage.CHECKING_SMS, ctx.getStage());
    }

    @Test
    void shouldNotShareListsWithCopy() {
        ctx.appendToList(FactKeys.ADDITIONAL_DETAILS, "event in March");
        ctx.appendTurn("user", "hello");

        SessionContext copy = ctx.copy();
        copy.appendToList(FactKeys.ADDITIONAL_DETAILS, "budget is small");
        copy.appendTurn("assistant", "hi");

        assertEquals(List.of("event in March"), ctx.getStringList(FactKeys.ADDITIONAL_DETAILS));
        assertEquals(1, ctx.getHistory().size());
        assertEquals(2, copy.getStringList(FactKeys.ADDITIONAL_DETAILS).size());
    }

    @Test
    void shouldParseStageLabelsWithinRole() {
        assertEquals(UnknownStage.START, ConversationStage.parse(CallerRole.UNKNOWN, null).orElseThrow());
        assertEquals(DeliveryStage.OTP_NOT_FOUND,
                ConversationStage.parse(CallerRole.DELIVERY, " OTP_NOT_FOUND ").orElseThrow());
        assertTrue(ConversationStage.parse(CallerRole.DELIVERY, "asking_purpose").isEmpty());
        assertTrue(ConversationStage.parse(CallerRole.UNDETERMINED, "start").isEmpty());
    }
}

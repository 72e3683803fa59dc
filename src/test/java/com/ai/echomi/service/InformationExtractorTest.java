package com.ai.echomi.service;

import com.ai.echomi.client.LanguageModelService;
import com.ai.echomi.dto.ExtractedFacts;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InformationExtractorTest {

    private LanguageModelService languageModel;
    private InformationExtractor extractor;

    @BeforeEach
    void setUp() {
        languageModel = mock(LanguageModelService.class);
        extractor = new InformationExtractor(languageModel, new RuleBasedFactExtractor(), new ObjectMapper());
    }

    @Test
    void shouldUseModelAnswerWhenItIsValidJson() {
        when(languageModel.isAvailable()).thenReturn(true);
        when(languageModel.complete(anyString(), anyString(), eq(true), anyDouble()))
                .thenReturn(Optional.of("Sure: {\"name\": \"Anita Rao\", \"purpose\": \"job interview\", "
                        + "\"phone\": \"98765 43210\", \"company\": \"null\"}"));

        ExtractedFacts facts = extractor.extract("I'm Anita, calling about the interview", Map.of());

        assertEquals("Anita Rao", facts.getName());
        assertEquals("job interview", facts.getPurpose());
        assertEquals("+919876543210", facts.getPhone());
        assertNull(facts.getCompany());
    }

    @Test
    void shouldFallBackToRulesWhenModelAnswerIsMalformed() {
        when(languageModel.isAvailable()).thenReturn(true);
        when(languageModel.complete(anyString(), anyString(), anyBoolean(), anyDouble()))
                .thenReturn(Optional.of("{\"name\": \"Anita\""));

        ExtractedFacts facts = extractor.extract("My name is Rahul Sharma from Acme", Map.of());

        assertEquals("Rahul Sharma", facts.getName());
    }

    @Test
    void shouldFallBackToRulesWhenModelGivesProse() {
        when(languageModel.isAvailable()).thenReturn(true);
        when(languageModel.complete(anyString(), anyString(), anyBoolean(), anyDouble()))
                .thenReturn(Optional.of("The caller did not say."));

        assertEquals("Zomato", extractor.extract("delivery from zomato", Map.of()).getCompany());
    }

    @Test
    void shouldNotCallModelWhenUnavailable() {
        when(languageModel.isAvailable()).thenReturn(false);

        ExtractedFacts facts = extractor.extract("call me on 9876543210", Map.of());

        assertEquals("+919876543210", facts.getPhone());
        verify(languageModel, never()).complete(anyString(), anyString(), anyBoolean(), anyDouble());
    }

    @Test
    void shouldReturnEmptyFactsForBlankUtterance() {
        assertTrue(extractor.extract(" ", Map.of()).isEmpty());
    }
}

package com.ai.echomi.utils;

import com.ai.echomi.conversation.Language;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LanguageDetectorTest {

    @Test
    void shouldDetectDevanagariAsHindi() {
        assertEquals(Language.HI, LanguageDetector.detect("मेरा नाम राहुल है"));
    }

    @Test
    void shouldDetectRomanizedHindiFromTwoMarkers() {
        assertEquals(Language.HI, LanguageDetector.detect("aap kaise ho"));
        assertEquals(Language.EN, LanguageDetector.detect("hai there"));
        assertEquals(Language.EN, LanguageDetector.detect(null));
    }
}

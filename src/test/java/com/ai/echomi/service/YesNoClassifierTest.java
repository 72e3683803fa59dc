package com.ai.echomi.service;

import com.ai.echomi.conversation.YesNoResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class YesNoClassifierTest {

    private final YesNoClassifier classifier = new YesNoClassifier();

    @Test
    void shouldRecognizeShortAnswers() {
        assertEquals(YesNoResult.YES, classifier.classify("Yes!"));
        assertEquals(YesNoResult.YES, classifier.classify("हाँ"));
        assertEquals(YesNoResult.NO, classifier.classify("no"));
        assertEquals(YesNoResult.NO, classifier.classify("नहीं"));
    }

    @Test
    void shouldReadDontNeedAsNoWhenItContainsNeed() {
        assertEquals(YesNoResult.NO, classifier.classify("I don't need the OTP"));
        assertEquals(YesNoResult.NO, classifier.classify("no thanks, all good"));
    }

    @Test
    void shouldReadNeedAsYes() {
        assertEquals(YesNoResult.YES, classifier.classify("yes I need the OTP please"));
        assertTrue(classifier.isAffirmative("I need it"));
    }

    @Test
    void shouldReturnUnknownWhenBothOrNeither() {
        assertEquals(YesNoResult.UNKNOWN, classifier.classify("yes no"));
        assertEquals(YesNoResult.UNKNOWN, classifier.classify("maybe later"));
        assertEquals(YesNoResult.UNKNOWN, classifier.classify(null));
        assertFalse(classifier.isNegative("maybe later"));
    }
}

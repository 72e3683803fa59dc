package com.ai.echomi.service;

import com.ai.echomi.client.LanguageModelService;
import com.ai.echomi.client.OfflineLanguageModelService;
import com.ai.echomi.dto.FollowupPlan;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FollowupPlannerTest {

    private final FollowupPlanner offline =
            new FollowupPlanner(new OfflineLanguageModelService(), new ObjectMapper(), "Ruchit");

    @Test
    void shouldAskAboutTypeAndScaleForSponsorship() {
        FollowupPlan plan = offline.plan("sponsorship for our college fest", "Priya");

        assertTrue(plan.isNeedsFollowup());
        assertEquals("high", plan.getImportance());
        assertEquals("And what's the scale or budget range you're considering?", plan.getSecondQuestion());
    }

    @Test
    void shouldRankBusinessAndMediaAsMedium() {
        assertEquals("medium", offline.plan("a business collaboration", null).getImportance());
        assertEquals("medium", offline.plan("I'm a journalist writing an article", null).getImportance());
        assertEquals("high", offline.plan("seed funding for my startup", null).getImportance());
    }

    @Test
    void shouldMentionOwnerInGenericProfessionalFollowup() {
        FollowupPlan plan = offline.plan("about a new project proposal", null);

        assertEquals("What would be the best time frame for Ruchit to get back to you on this?", plan.getSecondQuestion());
    }

    @Test
    void shouldSkipFollowupForSimpleInquiry() {
        FollowupPlan plan = offline.plan("wanted to return his umbrella", null);

        assertFalse(plan.isNeedsFollowup());
        assertEquals("low", plan.getImportance());
        assertNull(plan.getFirstQuestion());
        assertFalse(offline.plan(" ", null).isNeedsFollowup());
    }

    @Test
    void shouldPreferModelPlanWhenAvailable() {
        LanguageModelService model = mock(LanguageModelService.class);
        when(model.isAvailable()).thenReturn(true);
        when(model.complete(anyString(), anyString(), anyBoolean(), anyDouble()))
                .thenReturn(Optional.of("{\"needs_followup\": true, \"importance_level\": \"HIGH\", "
                        + "\"first_question\": \"Which role?\", \"second_question\": null, \"reasoning\": \"job\"}"));
        FollowupPlanner planner = new FollowupPlanner(model, new ObjectMapper(), "Ruchit");

        FollowupPlan plan = planner.plan("job opening", "Priya");

        assertEquals("high", plan.getImportance());
        assertEquals("Which role?", plan.getFirstQuestion());
        assertNull(plan.getSecondQuestion());
    }

    @Test
    void shouldUseRulesWhenModelAsksFollowupWithoutQuestion() {
        LanguageModelService model = mock(LanguageModelService.class);
        when(model.isAvailable()).thenReturn(true);
        when(model.complete(anyString(), anyString(), anyBoolean(), anyDouble()))
                .thenReturn(Optional.of("{\"needs_followup\": true}"));
        FollowupPlanner planner = new FollowupPlanner(model, new ObjectMapper(), "Ruchit");

        FollowupPlan plan = planner.plan("sponsorship", null);

        assertTrue(plan.getFirstQuestion().contains("sponsorship"));
    }
}

package com.ai.echomi.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class FollowupPlan {

    private boolean needsFollowup;

    /** low, medium or high */
    private String importance;

    private String firstQuestion;

    private String secondQuestion;

    private String reasoning;

    public static FollowupPlan none(String reasoning) {
        return new FollowupPlan(false, "low", null, null, reasoning);
    }

    /** Plain map form kept in the session facts, so it survives the JSON round trip. */
    public Map<String, Object> toFact() {
        Map<String, Object> fact = new LinkedHashMap<>();
        fact.put("needs_followup", needsFollowup);
        fact.put("importance", importance);
        if (firstQuestion != null) fact.put("first_question", firstQuestion);
        if (secondQuestion != null) fact.put("second_question", secondQuestion);
        if (reasoning != null) fact.put("reasoning", reasoning);
        return fact;
    }
}

package com.ai.echomi.dto;

import com.ai.echomi.conversation.CallAction;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;
import java.util.Map;

@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TurnResponse {

    private String responseText;

    private String conversationStage;

    private String callerRole;

    private Map<String, Object> collectedInfo;

    private CallAction action;

    private boolean endCall;

    private boolean requiresSms;

    private String companyRequested;

    private String intent;

    private List<HistoryEntry> updatedHistory;

    private String language;

    private String callSid;

    private String conversationSummary;
}

package com.ai.echomi.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /generate}. A plain turn carries {@code newMessage}; an SMS
 * reprocessing call sets {@code requiresReprocessing} and carries {@code smsData}.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TurnRequest {

    private String newMessage;

    private String callerRole;

    private String conversationStage;

    private Map<String, Object> collectedInfo = new LinkedHashMap<>();

    private List<HistoryEntry> history = new ArrayList<>();

    private String responseLanguage;

    private String callSid;

    private String callerId;

    private boolean requiresReprocessing;

    private String company;

    private List<SmsMessageDto> smsData = new ArrayList<>();
}

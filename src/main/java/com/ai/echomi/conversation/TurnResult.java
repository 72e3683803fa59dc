package com.ai.echomi.conversation;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one conversation turn: what to say, where the session moved to and
 * what side effect the caller should perform.
 */
@Getter
@Builder
@ToString
public class TurnResult {

    private final String responseText;
    private final SessionContext context;
    private final CallAction action;
    private final Intent intent;

    public ConversationStage getStage() {
        return context.getStage();
    }

    public CallerRole getCallerRole() {
        return context.getCallerRole();
    }

    public boolean isEndCall() {
        return action != null && action.isEndCall();
    }
}

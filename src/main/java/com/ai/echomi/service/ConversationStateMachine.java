package com.ai.echomi.service;

import com.ai.echomi.component.ResponsePhrases;
import com.ai.echomi.conversation.CallAction;
import com.ai.echomi.conversation.CallerRole;
import com.ai.echomi.conversation.ConversationStage;
import com.ai.echomi.conversation.DeliveryStage;
import com.ai.echomi.conversation.FactKeys;
import com.ai.echomi.conversation.Intent;
import com.ai.echomi.conversation.SessionContext;
import com.ai.echomi.conversation.TurnResult;
import com.ai.echomi.conversation.UnknownStage;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pure turn function over the two stage graphs. The incoming context is never
 * modified; the returned result carries an updated copy.
 */
@Service
public class ConversationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ConversationStateMachine.class);

    private final IntentClassifier intentClassifier;
    private final DeliveryFlowService deliveryFlow;
    private final UnknownCallerFlowService unknownFlow;
    private final ResponsePhrases phrases;

    public ConversationStateMachine(IntentClassifier intentClassifier, DeliveryFlowService deliveryFlow,
                                    UnknownCallerFlowService unknownFlow, ResponsePhrases phrases) {
        this.intentClassifier = intentClassifier;
        this.deliveryFlow = deliveryFlow;
        this.unknownFlow = unknownFlow;
        this.phrases = phrases;
    }

    public TurnResult advance(SessionContext context, String utterance) {
        SessionContext ctx = context.copy();
        String text = StringUtils.defaultString(utterance).trim();
        Intent intent = intentClassifier.classify(text);
        log.debug("[{}] {} / {} intent={}", ctx.getSessionId(), ctx.getCallerRole().label(),
                ctx.getStage() == null ? "-" : ctx.getStage().label(), intent.label());

        if (intentClassifier.isUrgent(text)) {
            return urgent(ctx, intent);
        }

        if (ctx.getCallerRole() == CallerRole.UNDETERMINED) {
            CallerRole role = intentClassifier.identifyRole(text);
            ctx.handOver(ConversationStage.startOf(role));
            log.debug("[{}] caller identified as {}", ctx.getSessionId(), role.label());
        }

        if (ctx.getStage() == DeliveryStage.WAITING_FOR_CONTEXT) {
            if (intent == Intent.INITIAL_DELIVERY || intentClassifier.isDeliveryMention(text)) {
                return deliveryFlow.handleStart(ctx, text, intent);
            }
            log.debug("[{}] no delivery context, handing over to unknown caller flow", ctx.getSessionId());
            ctx.handOver(UnknownStage.START);
        }

        return switch (ctx.getCallerRole()) {
            case DELIVERY -> deliveryFlow.handle(ctx, text, intent);
            case UNKNOWN -> unknownFlow.handle(ctx, text, intent);
            case UNDETERMINED -> throw new IllegalStateException("caller role was not resolved");
        };
    }

    private TurnResult urgent(SessionContext ctx, Intent intent) {
        String name = ctx.has(FactKeys.NAME) ? ctx.getString(FactKeys.NAME) : "An unknown caller";
        if (ctx.getCallerRole() == CallerRole.DELIVERY) {
            ctx.setStage(DeliveryStage.END_OF_CALL);
        } else {
            ctx.handOver(UnknownStage.END_OF_CALL);
        }
        log.info("[{}] urgent call from {}", ctx.getSessionId(), name);
        return TurnResult.builder()
                .responseText(phrases.urgentAcknowledged(ctx.getLanguage()))
                .context(ctx)
                .action(CallAction.urgentNotification("Urgent call from " + name + "."))
                .intent(intent)
                .build();
    }
}

package com.ai.echomi.service;

import com.ai.echomi.conversation.CallAction;
import com.ai.echomi.conversation.CallerRole;
import com.ai.echomi.conversation.ConversationStage;
import com.ai.echomi.conversation.DeliveryStage;
import com.ai.echomi.conversation.FactKeys;
import com.ai.echomi.conversation.Language;
import com.ai.echomi.conversation.SessionContext;
import com.ai.echomi.conversation.TurnResult;
import com.ai.echomi.conversation.UnknownStage;
import com.ai.echomi.dto.TurnRequest;
import com.ai.echomi.dto.TurnResponse;
import com.ai.echomi.exception.InvalidTurnRequestException;
import com.ai.echomi.utils.LanguageDetector;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.UUID;

/**
 * Single entry for a {@code /generate} call: validates the request, runs the turn
 * (or the SMS reprocessing step), carries out owner notifications and shapes the
 * response.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    static final String USER = "user";
    static final String ASSISTANT = "assistant";

    private final ConversationStateMachine stateMachine;
    private final SmsReprocessingService smsReprocessing;
    private final OwnerNotifier ownerNotifier;
    private final CallSummaryService callSummary;

    public ConversationOrchestrator(ConversationStateMachine stateMachine, SmsReprocessingService smsReprocessing,
                                    OwnerNotifier ownerNotifier, CallSummaryService callSummary) {
        this.stateMachine = stateMachine;
        this.smsReprocessing = smsReprocessing;
        this.ownerNotifier = ownerNotifier;
        this.callSummary = callSummary;
    }

    public TurnResponse process(TurnRequest request) {
        if (request == null) {
            throw new InvalidTurnRequestException("Request body is required");
        }
        boolean reprocessing = request.isRequiresReprocessing();
        String message = StringUtils.trimToEmpty(request.getNewMessage());
        if (!reprocessing && message.isEmpty()) {
            throw new InvalidTurnRequestException("new_message is required");
        }

        SessionContext ctx = buildContext(request, message);
        ConversationStage before = ctx.getStage();

        TurnResult result;
        if (reprocessing) {
            int batch = request.getSmsData() == null ? 0 : request.getSmsData().size();
            log.info("[{}] SMS reprocessing with {} messages", ctx.getSessionId(), batch);
            result = smsReprocessing.reprocess(ctx, request.getCompany(), request.getSmsData());
        } else {
            result = stateMachine.advance(ctx, message);
        }

        SessionContext after = result.getContext();
        if (!reprocessing) {
            after.appendTurn(USER, message);
        }
        after.appendTurn(ASSISTANT, result.getResponseText());
        log.debug("[{}] {} -> {} action={}", ctx.getSessionId(),
                before == null ? "-" : before.label(), after.getStage().label(), result.getAction());

        notifyOwner(before, result);

        CallAction action = result.getAction();
        boolean requestsSms = action.getType() == CallAction.Type.REQUEST_SMS_OTP;
        TurnResponse.TurnResponseBuilder response = TurnResponse.builder()
                .responseText(result.getResponseText())
                .conversationStage(after.getStage().label())
                .callerRole(after.getCallerRole().label())
                .collectedInfo(new LinkedHashMap<>(after.getFacts()))
                .action(action)
                .endCall(result.isEndCall())
                .requiresSms(requestsSms)
                .companyRequested(requestsSms ? action.getCompany() : null)
                .intent(result.getIntent() == null ? null : result.getIntent().label())
                .updatedHistory(new ArrayList<>(after.getHistory()))
                .language(after.getLanguage().code())
                .callSid(request.getCallSid());
        if (result.isEndCall()) {
            response.conversationSummary(callSummary.summarize(after.getHistory(), after.getFacts()));
        }
        return response.build();
    }

    private SessionContext buildContext(TurnRequest request, String message) {
        CallerRole role = CallerRole.fromLabel(request.getCallerRole())
                .orElseThrow(() -> new InvalidTurnRequestException("Unknown caller_role: " + request.getCallerRole()));
        String stageLabel = request.getConversationStage();

        ConversationStage stage;
        if (request.isRequiresReprocessing() && role == CallerRole.UNDETERMINED) {
            role = CallerRole.DELIVERY;
            stage = DeliveryStage.CHECKING_SMS;
        } else if (role == CallerRole.UNDETERMINED) {
            if (StringUtils.isNotBlank(stageLabel) && !ConversationStage.START_LABEL.equalsIgnoreCase(stageLabel.trim())) {
                throw new InvalidTurnRequestException("Stage " + stageLabel + " requires a caller_role");
            }
            stage = null;
        } else {
            final CallerRole resolved = role;
            stage = ConversationStage.parse(role, stageLabel)
                    .orElseThrow(() -> new InvalidTurnRequestException(
                            "Stage " + stageLabel + " is not a " + resolved.label() + " stage"));
        }

        Language language = Language.fromCode(request.getResponseLanguage())
                .orElseGet(() -> LanguageDetector.detect(message));
        String sessionId = StringUtils.defaultIfBlank(request.getCallSid(), "local-" + UUID.randomUUID());

        SessionContext ctx = new SessionContext(sessionId, request.getCallerId(), role, stage, language);
        ctx.putAll(request.getCollectedInfo());
        ctx.addHistory(request.getHistory());
        return ctx;
    }

    private void notifyOwner(ConversationStage before, TurnResult result) {
        CallAction action = result.getAction();
        SessionContext after = result.getContext();
        if (action.getType() == CallAction.Type.URGENT_NOTIFICATION) {
            boolean sent = ownerNotifier.notifyUrgent(action.getMessage());
            log.info("[{}] urgent notification sent={}", after.getSessionId(), sent);
            return;
        }
        boolean reachedEnd = after.getStage() == UnknownStage.END_OF_CALL && before != UnknownStage.END_OF_CALL;
        if (reachedEnd && (after.has(FactKeys.NAME) || after.has(FactKeys.PURPOSE))) {
            boolean sent = ownerNotifier.notifyUnknownCaller(after);
            log.info("[{}] unknown caller notification sent={}", after.getSessionId(), sent);
        }
    }
}

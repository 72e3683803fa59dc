package com.ai.echomi.service;

import com.ai.echomi.component.ResponsePhrases;
import com.ai.echomi.conversation.CallAction;
import com.ai.echomi.conversation.FactKeys;
import com.ai.echomi.conversation.Intent;
import com.ai.echomi.conversation.Language;
import com.ai.echomi.conversation.SessionContext;
import com.ai.echomi.conversation.TurnResult;
import com.ai.echomi.conversation.UnknownStage;
import com.ai.echomi.dto.ExtractedFacts;
import com.ai.echomi.dto.FollowupPlan;
import com.ai.echomi.utils.PhoneNumbers;
import com.ai.echomi.utils.SpeechFormat;
import com.ai.echomi.utils.TextUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Screens callers who are not delivering anything: name, purpose, optional
 * followup questions and a callback number.
 */
@Service
public class UnknownCallerFlowService {

    private static final Logger log = LoggerFactory.getLogger(UnknownCallerFlowService.class);

    static final int MAX_NAME_ATTEMPTS = 3;

    static final String UNKNOWN_CALLER = "Unknown caller";

    static final String CALLERS_NUMBER = "Caller's Number";

    private static final Set<String> NOT_A_NAME = Set.of("yes", "no", "hello", "hi");

    private final InformationExtractor informationExtractor;
    private final FollowupPlanner followupPlanner;
    private final ResponsePhrases phrases;

    public UnknownCallerFlowService(InformationExtractor informationExtractor, FollowupPlanner followupPlanner,
                                    ResponsePhrases phrases) {
        this.informationExtractor = informationExtractor;
        this.followupPlanner = followupPlanner;
        this.phrases = phrases;
    }

    public TurnResult handle(SessionContext ctx, String text, Intent intent) {
        UnknownStage stage = (UnknownStage) ctx.getStage();
        Language lang = ctx.getLanguage();

        if (stage == UnknownStage.START) {
            return reply(ctx, UnknownStage.ASKING_NAME, phrases.askName(lang), intent);
        }
        if (stage == UnknownStage.COLLECTING_CONTACT && intent == Intent.PROVIDE_SELF_NUMBER) {
            String callerPhone = PhoneNumbers.normalize(StringUtils.defaultString(ctx.getCallerId()));
            ctx.put(FactKeys.PHONE, callerPhone != null ? callerPhone : CALLERS_NUMBER);
            return reply(ctx, UnknownStage.END_OF_CALL, phrases.selfNumberNoted(lang), intent);
        }

        ExtractedFacts extracted = informationExtractor.extract(text, ctx.getFacts());
        ctx.putIfAbsent(FactKeys.NAME, extracted.getName());
        ctx.putIfAbsent(FactKeys.PHONE, extracted.getPhone());

        return switch (stage) {
            case START -> throw new IllegalStateException("start is handled above");
            case ASKING_NAME -> handleName(ctx, text, intent);
            case ASKING_PURPOSE -> {
                ctx.putIfAbsent(FactKeys.PURPOSE, StringUtils.defaultIfBlank(extracted.getPurpose(), text.trim()));
                if (!ctx.getBoolean(FactKeys.FOLLOWUP_ASKED)) {
                    FollowupPlan plan = followupPlanner.plan(ctx.getString(FactKeys.PURPOSE), ctx.getString(FactKeys.NAME));
                    if (plan.isNeedsFollowup() && StringUtils.isNotBlank(plan.getFirstQuestion())) {
                        ctx.put(FactKeys.FOLLOWUP_ASKED, true);
                        ctx.put(FactKeys.FOLLOWUP_PLAN, plan.toFact());
                        ctx.put(FactKeys.FOLLOWUP_IMPORTANCE, plan.getImportance());
                        ctx.put(FactKeys.FOLLOWUP_SECOND_QUESTION, TextUtils.nullIfEmpty(plan.getSecondQuestion()));
                        log.debug("[{}] followup planned ({}): {}", ctx.getSessionId(), plan.getImportance(), plan.getReasoning());
                        yield reply(ctx, UnknownStage.ASKING_FOLLOWUP, plan.getFirstQuestion(), intent);
                    }
                }
                yield contactStep(ctx, phrases.askCallbackNumber(lang), intent);
            }
            case ASKING_FOLLOWUP -> {
                ctx.appendToList(FactKeys.ADDITIONAL_DETAILS, text.trim());
                String second = ctx.getString(FactKeys.FOLLOWUP_SECOND_QUESTION);
                if (StringUtils.isNotBlank(second) && ctx.getStringList(FactKeys.ADDITIONAL_DETAILS).size() == 1) {
                    yield reply(ctx, UnknownStage.ASKING_SECOND_FOLLOWUP, second, intent);
                }
                yield contactStep(ctx, phrases.askCallbackNumberAfterDetails(lang), intent);
            }
            case ASKING_SECOND_FOLLOWUP -> {
                ctx.appendToList(FactKeys.ADDITIONAL_DETAILS, text.trim());
                yield contactStep(ctx, phrases.askCallbackNumberAfterAllDetails(lang), intent);
            }
            case COLLECTING_CONTACT -> {
                if (ctx.has(FactKeys.PHONE)) {
                    yield numberConfirmed(ctx, intent);
                }
                yield reply(ctx, UnknownStage.COLLECTING_CONTACT, phrases.askNumberAgain(lang), intent);
            }
            case END_OF_CALL -> reply(ctx, UnknownStage.END_OF_CALL, phrases.unknownCallerGoodbye(lang), intent);
        };
    }

    private TurnResult handleName(SessionContext ctx, String text, Intent intent) {
        Language lang = ctx.getLanguage();
        if (ctx.has(FactKeys.NAME)) {
            return reply(ctx, UnknownStage.ASKING_PURPOSE, phrases.askPurpose(lang, ctx.getString(FactKeys.NAME)), intent);
        }
        String candidate = text.trim();
        if (looksLikeName(candidate)) {
            String name = TextUtils.titleCase(candidate);
            ctx.put(FactKeys.NAME, name);
            return reply(ctx, UnknownStage.ASKING_PURPOSE, phrases.askPurpose(lang, name), intent);
        }
        int attempts = ctx.getInt(FactKeys.NAME_ATTEMPTS) + 1;
        ctx.put(FactKeys.NAME_ATTEMPTS, attempts);
        if (attempts >= MAX_NAME_ATTEMPTS) {
            log.debug("[{}] name not understood after {} attempts", ctx.getSessionId(), attempts);
            ctx.put(FactKeys.NAME, UNKNOWN_CALLER);
            return reply(ctx, UnknownStage.ASKING_PURPOSE, phrases.askPurposeWithoutName(lang), intent);
        }
        return reply(ctx, UnknownStage.ASKING_NAME, phrases.askSpellName(lang), intent);
    }

    static boolean looksLikeName(String candidate) {
        return !candidate.isEmpty()
                && candidate.length() <= 20
                && candidate.chars().anyMatch(Character::isLetter)
                && !NOT_A_NAME.contains(TextUtils.normalizeForMatching(candidate));
    }

    private TurnResult contactStep(SessionContext ctx, String askNumber, Intent intent) {
        if (ctx.has(FactKeys.PHONE)) {
            return numberConfirmed(ctx, intent);
        }
        return reply(ctx, UnknownStage.COLLECTING_CONTACT, askNumber, intent);
    }

    private TurnResult numberConfirmed(SessionContext ctx, Intent intent) {
        String spoken = SpeechFormat.spaceDigits(PhoneNumbers.national(ctx.getString(FactKeys.PHONE)));
        return reply(ctx, UnknownStage.END_OF_CALL, phrases.numberConfirmed(ctx.getLanguage(), spoken), intent);
    }

    static TurnResult reply(SessionContext ctx, UnknownStage next, String response, Intent intent) {
        ctx.setStage(next);
        return TurnResult.builder()
                .responseText(response)
                .context(ctx)
                .action(next.isTerminal() ? CallAction.endOfCall() : CallAction.none())
                .intent(intent)
                .build();
    }
}

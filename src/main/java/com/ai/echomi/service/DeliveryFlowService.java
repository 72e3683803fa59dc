package com.ai.echomi.service;

import com.ai.echomi.client.LocationService;
import com.ai.echomi.component.ResponsePhrases;
import com.ai.echomi.conversation.CallAction;
import com.ai.echomi.conversation.DeliveryStage;
import com.ai.echomi.conversation.FactKeys;
import com.ai.echomi.conversation.Intent;
import com.ai.echomi.conversation.Language;
import com.ai.echomi.conversation.SessionContext;
import com.ai.echomi.conversation.TurnResult;
import com.ai.echomi.conversation.YesNoResult;
import com.ai.echomi.dto.ExtractedFacts;
import com.ai.echomi.dto.LocationMatch;
import com.ai.echomi.dto.Route;
import com.ai.echomi.entity.OrderStatus;
import com.ai.echomi.utils.SpeechFormat;
import com.ai.echomi.utils.TextUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Stage graph for delivery partners: company, directions, arrival, then the OTP.
 */
@Service
public class DeliveryFlowService {

    private static final Logger log = LoggerFactory.getLogger(DeliveryFlowService.class);

    static final int MAX_LOCATION_ATTEMPTS = 3;

    private static final List<String> GREETINGS = List.of("hello", "hi", "hey", "namaste", "नमस्ते", "हेलो");

    private static final List<String> HELP_PHRASES = List.of(
            "need help", "help", "directions", "how to get", "where is", "guide me", "lost",
            "मदद", "रास्ता", "कहाँ", "कैसे"
    );

    private static final List<String> ARRIVAL_PHRASES = List.of(
            "here", "arrived", "at the location", "reached", "outside", "at your place", "at the door",
            "यहाँ", "पहुँच", "आ गया", "आ चुका", "हूं", "हूँ"
    );

    private static final List<String> LOST_PHRASES = List.of("lost", "can't find", "help", "confused", "where");

    private static final List<String> CLOSING_WORDS = List.of("thank", "bye", "धन्यवाद", "शुक्रिया");

    private final IntentClassifier intentClassifier;
    private final YesNoClassifier yesNoClassifier;
    private final InformationExtractor informationExtractor;
    private final RuleBasedFactExtractor ruleBased;
    private final LocationService locationService;
    private final OrderLedger orderLedger;
    private final ResponsePhrases phrases;

    public DeliveryFlowService(IntentClassifier intentClassifier, YesNoClassifier yesNoClassifier,
                               InformationExtractor informationExtractor, RuleBasedFactExtractor ruleBased,
                               LocationService locationService, OrderLedger orderLedger, ResponsePhrases phrases) {
        this.intentClassifier = intentClassifier;
        this.yesNoClassifier = yesNoClassifier;
        this.informationExtractor = informationExtractor;
        this.ruleBased = ruleBased;
        this.locationService = locationService;
        this.orderLedger = orderLedger;
        this.phrases = phrases;
    }

    /**
     * Advances a delivery session by one utterance. {@code ctx} is the turn's own
     * copy and is updated in place.
     */
    public TurnResult handle(SessionContext ctx, String text, Intent intent) {
        DeliveryStage stage = (DeliveryStage) ctx.getStage();
        Language lang = ctx.getLanguage();

        if (intent == Intent.REQUESTING_OTP && entersOtpProtocolFrom(stage)) {
            log.debug("[{}] OTP requested at {}", ctx.getSessionId(), stage.label());
            return requestSmsOtp(ctx, text, intent);
        }

        return switch (stage) {
            case START -> handleStart(ctx, text, intent);
            case WAITING_FOR_CONTEXT -> throw new IllegalStateException("waiting_for_context is routed by the state machine");
            case ASKING_COMPANY_FIRST -> {
                String company = companyFrom(ctx, text);
                ctx.put(FactKeys.COMPANY, company);
                yield reply(ctx, DeliveryStage.ASKING_LOCATION_HELP, phrases.companyNoted(lang, company), intent);
            }
            case ASKING_LOCATION_HELP -> {
                String lower = text.toLowerCase();
                if (TextUtils.containsAny(lower, HELP_PHRASES)) {
                    yield reply(ctx, DeliveryStage.GETTING_CURRENT_LOCATION, phrases.askCurrentLocation(lang), intent);
                }
                if (TextUtils.containsAny(lower, ARRIVAL_PHRASES)) {
                    yield arrivalCheck(ctx, intent);
                }
                yield reply(ctx, DeliveryStage.ASKING_LOCATION_HELP, phrases.clarifyLocationHelp(lang), intent);
            }
            case GETTING_CURRENT_LOCATION -> handleLocation(ctx, text, intent);
            case TRAVELING_TO_LOCATION -> {
                String lower = text.toLowerCase();
                // "where" contains "here", so lost phrasing is looked at first
                if (TextUtils.containsAny(lower, LOST_PHRASES)) {
                    yield reply(ctx, DeliveryStage.GETTING_CURRENT_LOCATION, phrases.askLandmarks(lang), intent);
                }
                if (TextUtils.containsAny(lower, ARRIVAL_PHRASES)) {
                    yield arrivalCheck(ctx, intent);
                }
                yield reply(ctx, DeliveryStage.TRAVELING_TO_LOCATION, phrases.waitForArrival(lang), intent);
            }
            case ASKING_COMPANY_FOR_OTP -> {
                ctx.put(FactKeys.COMPANY, companyFrom(ctx, text));
                yield arrivalCheck(ctx, intent);
            }
            case ASKING_IF_OTP_NEEDED -> {
                YesNoResult answer = yesNoClassifier.classify(text);
                if (answer == YesNoResult.YES || intentClassifier.isOtpRequest(text)) {
                    yield requestSmsOtp(ctx, text, intent);
                }
                if (answer == YesNoResult.NO) {
                    yield reply(ctx, DeliveryStage.END_OF_CALL, phrases.noOtpGoodbye(lang), intent);
                }
                yield reply(ctx, DeliveryStage.ASKING_IF_OTP_NEEDED, phrases.clarifyOtpNeeded(lang), intent);
            }
            case REQUESTING_SMS_OTP -> requestSmsOtp(ctx, text, intent);
            case ASKING_OTP_COMPANY -> {
                String company = companyFrom(ctx, text);
                ctx.put(FactKeys.COMPANY, company);
                yield checkSms(ctx, phrases.lookingForCompanyOtp(lang, company), intent);
            }
            case CHECKING_SMS -> checkSms(ctx,
                    phrases.checkingMessages(lang, ctx.getString(FactKeys.COMPANY)), intent);
            case OTP_NOT_FOUND, MANUAL_OTP_ENTRY -> {
                String otp = SpeechFormat.parseSpokenOtp(text);
                if (otp == null) {
                    yield reply(ctx, stage, phrases.manualOtpNotUnderstood(lang), intent);
                }
                ctx.put(FactKeys.MANUAL_OTP, otp);
                yield reply(ctx, DeliveryStage.CONFIRMING_MANUAL_OTP,
                        phrases.confirmManualOtp(lang, companyOrDefault(ctx), SpeechFormat.spaceDigits(otp)), intent);
            }
            case CONFIRMING_MANUAL_OTP -> {
                String otp = ctx.getString(FactKeys.MANUAL_OTP);
                if (otp != null && yesNoClassifier.isAffirmative(text)) {
                    String company = companyOrDefault(ctx);
                    ctx.setStage(DeliveryStage.OTP_PROVIDED);
                    yield TurnResult.builder()
                            .responseText(phrases.manualOtpConfirmed(lang, company, SpeechFormat.spaceDigits(otp)))
                            .context(ctx)
                            .action(CallAction.provideOtp(otp, company, false))
                            .intent(intent)
                            .build();
                }
                yield reply(ctx, DeliveryStage.MANUAL_OTP_ENTRY, phrases.askCorrectOtp(lang), intent);
            }
            case OTP_PROVIDED, CALL_ENDING, END_OF_CALL -> {
                if (intent == Intent.ENDING_CONVERSATION || TextUtils.containsAny(text.toLowerCase(), CLOSING_WORDS)) {
                    yield reply(ctx, DeliveryStage.END_OF_CALL, phrases.deliveryWelcomeGoodbye(lang), intent);
                }
                yield reply(ctx, stage, phrases.deliveryFallback(lang), intent);
            }
        };
    }

    /**
     * Opening turn of a delivery call, also used when a caller at
     * {@code waiting_for_context} turns out to be a delivery partner.
     */
    public TurnResult handleStart(SessionContext ctx, String text, Intent intent) {
        Language lang = ctx.getLanguage();
        if (intent == Intent.INITIAL_DELIVERY || intentClassifier.isDeliveryMention(text)) {
            mergeFacts(ctx, text);
            if (ctx.has(FactKeys.COMPANY)) {
                return reply(ctx, DeliveryStage.ASKING_LOCATION_HELP,
                        phrases.deliveryFromCompany(lang, ctx.getString(FactKeys.COMPANY)), intent);
            }
            return reply(ctx, DeliveryStage.ASKING_COMPANY_FIRST, phrases.askDeliveryCompany(lang), intent);
        }
        if (isGreeting(text)) {
            return reply(ctx, DeliveryStage.WAITING_FOR_CONTEXT, phrases.greeting(lang), intent);
        }
        return reply(ctx, DeliveryStage.START, phrases.askIfDelivery(lang), intent);
    }

    public boolean isGreeting(String text) {
        String normalized = TextUtils.normalizeForMatching(text);
        for (String word : normalized.split("[\\s,]+")) {
            if (GREETINGS.contains(word)) return true;
        }
        return false;
    }

    private TurnResult handleLocation(SessionContext ctx, String text, Intent intent) {
        Language lang = ctx.getLanguage();
        List<LocationMatch> matches = locationService.geocode(text);
        if (matches.isEmpty()) {
            int attempts = ctx.getInt(FactKeys.LOCATION_ATTEMPTS) + 1;
            ctx.put(FactKeys.LOCATION_ATTEMPTS, attempts);
            log.debug("[{}] location not found, attempt {}", ctx.getSessionId(), attempts);
            if (attempts >= MAX_LOCATION_ATTEMPTS) {
                return reply(ctx, DeliveryStage.TRAVELING_TO_LOCATION, phrases.navigateManually(lang), intent);
            }
            return reply(ctx, DeliveryStage.GETTING_CURRENT_LOCATION, phrases.locationNotFound(lang), intent);
        }

        LocationMatch best = matches.get(0);
        ctx.put(FactKeys.CURRENT_LOCATION, best.getName());
        Optional<Route> route = locationService.directionsToDestination(best);
        if (route.isEmpty() || route.get().getSteps().isEmpty()) {
            return reply(ctx, DeliveryStage.TRAVELING_TO_LOCATION,
                    phrases.locationWithoutDirections(lang, best.getName()), intent);
        }
        String steps = String.join(", then ", route.get().getSteps());
        return reply(ctx, DeliveryStage.TRAVELING_TO_LOCATION,
                phrases.directions(lang, best.getName(), steps, route.get().getEtaMinutes()), intent);
    }

    /**
     * The partner is at the door. Without a company there is nothing to look up
     * yet; with one, the session gets an approved order in the ledger.
     */
    private TurnResult arrivalCheck(SessionContext ctx, Intent intent) {
        Language lang = ctx.getLanguage();
        if (!ctx.has(FactKeys.COMPANY)) {
            return reply(ctx, DeliveryStage.ASKING_COMPANY_FOR_OTP, phrases.askCompanyOnArrival(lang), intent);
        }
        String company = ctx.getString(FactKeys.COMPANY);
        ensureApprovedOrder(ctx, company);
        return reply(ctx, DeliveryStage.ASKING_IF_OTP_NEEDED, phrases.arrivedAskOtp(lang, company), intent);
    }

    private void ensureApprovedOrder(SessionContext ctx, String company) {
        String existing = ctx.getString(FactKeys.ORDER_ID);
        if (existing != null && orderLedger.get(existing).isPresent()) {
            return;
        }
        String orderId = orderLedger.add(company, null, null);
        orderLedger.setStatus(orderId, OrderStatus.APPROVED);
        ctx.put(FactKeys.ORDER_ID, orderId);
        log.info("[{}] order {} opened for {} delivery", ctx.getSessionId(), orderId, company);
    }

    private TurnResult requestSmsOtp(SessionContext ctx, String text, Intent intent) {
        Language lang = ctx.getLanguage();
        if (!ctx.has(FactKeys.COMPANY)) {
            ruleBased.findCompany(text).ifPresent(c -> ctx.put(FactKeys.COMPANY, c));
        }
        if (!ctx.has(FactKeys.COMPANY)) {
            return reply(ctx, DeliveryStage.ASKING_OTP_COMPANY, phrases.askOtpCompany(lang), intent);
        }
        return checkSms(ctx, phrases.checkingMessages(lang, ctx.getString(FactKeys.COMPANY)), intent);
    }

    private TurnResult checkSms(SessionContext ctx, String response, Intent intent) {
        ctx.setStage(DeliveryStage.CHECKING_SMS);
        return TurnResult.builder()
                .responseText(response)
                .context(ctx)
                .action(CallAction.requestSmsOtp(ctx.getString(FactKeys.COMPANY)))
                .intent(intent)
                .build();
    }

    private void mergeFacts(SessionContext ctx, String text) {
        ExtractedFacts facts = informationExtractor.extract(text, ctx.getFacts());
        ctx.putIfAbsent(FactKeys.COMPANY, facts.getCompany());
        ctx.putIfAbsent(FactKeys.NAME, facts.getName());
        ctx.putIfAbsent(FactKeys.PHONE, facts.getPhone());
    }

    private String companyFrom(SessionContext ctx, String text) {
        ExtractedFacts facts = informationExtractor.extract(text, ctx.getFacts());
        if (StringUtils.isNotBlank(facts.getCompany())) {
            return facts.getCompany();
        }
        String answered = ruleBased.companyFromAnswer(text);
        return answered != null ? answered : companyOrDefault(ctx);
    }

    private static String companyOrDefault(SessionContext ctx) {
        return StringUtils.defaultIfBlank(ctx.getString(FactKeys.COMPANY), "delivery");
    }

    private static boolean entersOtpProtocolFrom(DeliveryStage stage) {
        return !stage.isTerminal()
                && !stage.expectsDigits()
                && stage != DeliveryStage.ASKING_OTP_COMPANY;
    }

    static TurnResult reply(SessionContext ctx, DeliveryStage next, String response, Intent intent) {
        ctx.setStage(next);
        return TurnResult.builder()
                .responseText(response)
                .context(ctx)
                .action(next.isTerminal() ? CallAction.endOfCall() : CallAction.none())
                .intent(intent)
                .build();
    }
}

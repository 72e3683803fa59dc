package com.ai.echomi.service;

import com.ai.echomi.component.ResponsePhrases;
import com.ai.echomi.conversation.CallAction;
import com.ai.echomi.conversation.CallerRole;
import com.ai.echomi.conversation.DeliveryStage;
import com.ai.echomi.conversation.FactKeys;
import com.ai.echomi.conversation.Intent;
import com.ai.echomi.conversation.Language;
import com.ai.echomi.conversation.SessionContext;
import com.ai.echomi.conversation.TurnResult;
import com.ai.echomi.dto.OtpMatch;
import com.ai.echomi.dto.ParsedMessage;
import com.ai.echomi.dto.SmsMessageDto;
import com.ai.echomi.utils.SpeechFormat;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Second half of the SMS OTP protocol: the caller comes back with the recent
 * messages from the courier's phone and the best OTP among them is read out.
 */
@Service
public class SmsReprocessingService {

    private static final Logger log = LoggerFactory.getLogger(SmsReprocessingService.class);

    static final double CONFIDENT = 0.8;

    private final OtpExtractionEngine otpEngine;
    private final OrderLedger orderLedger;
    private final ResponsePhrases phrases;

    public SmsReprocessingService(OtpExtractionEngine otpEngine, OrderLedger orderLedger, ResponsePhrases phrases) {
        this.otpEngine = otpEngine;
        this.orderLedger = orderLedger;
        this.phrases = phrases;
    }

    public TurnResult reprocess(SessionContext context, String company, List<SmsMessageDto> smsBatch) {
        SessionContext ctx = context.copy();
        if (ctx.getCallerRole() != CallerRole.DELIVERY) {
            ctx.handOver(DeliveryStage.CHECKING_SMS);
        }
        Language lang = ctx.getLanguage();
        String target = StringUtils.defaultIfBlank(company, ctx.getString(FactKeys.COMPANY));
        ctx.putIfAbsent(FactKeys.COMPANY, target);
        String spokenCompany = StringUtils.defaultIfBlank(target, "delivery");

        List<ParsedMessage> parsed = new ArrayList<>();
        if (smsBatch != null) {
            for (SmsMessageDto sms : smsBatch) {
                if (sms != null && StringUtils.isNotBlank(sms.getMessage())) {
                    parsed.add(otpEngine.parse(sms, target));
                }
            }
        }
        log.debug("[{}] reprocessing {} SMS for {}", ctx.getSessionId(), parsed.size(), spokenCompany);

        Optional<OtpMatch> best = otpEngine.findBestMatch(parsed, target);
        if (best.isEmpty()) {
            ctx.setStage(DeliveryStage.OTP_NOT_FOUND);
            String response = parsed.isEmpty()
                    ? phrases.noRecentSms(lang)
                    : phrases.otpNotInMessages(lang, parsed.size(), spokenCompany);
            return TurnResult.builder()
                    .responseText(response)
                    .context(ctx)
                    .action(CallAction.none())
                    .intent(Intent.REQUESTING_OTP)
                    .build();
        }

        OtpMatch match = best.get();
        ParsedMessage message = match.getMessage();
        String spaced = SpeechFormat.spaceDigits(message.getOtp());
        String sender = StringUtils.defaultIfBlank(message.getSender(), "an unknown sender");
        String response;
        if (match.isFallbackUsed()) {
            response = phrases.otpFoundWithoutCompanyMatch(lang, spokenCompany, sender, spaced);
        } else if (message.getConfidence() >= CONFIDENT) {
            response = phrases.otpFoundConfident(lang, spokenCompany, spaced);
        } else {
            response = phrases.otpFoundVerify(lang, spokenCompany, sender, spaced);
        }
        if (StringUtils.isNotBlank(message.getTrackingId())) {
            response = response + phrases.trackingSuffix(lang, message.getTrackingId());
        }

        if (orderLedger.recordDelivery(ctx.getString(FactKeys.ORDER_ID), message.getOtp())) {
            log.info("[{}] order {} completed with SMS OTP", ctx.getSessionId(), ctx.getString(FactKeys.ORDER_ID));
        }
        log.info("[{}] OTP found for {} (score {}, fallback {})", ctx.getSessionId(), spokenCompany,
                match.getScore(), match.isFallbackUsed());

        ctx.setStage(DeliveryStage.CALL_ENDING);
        return TurnResult.builder()
                .responseText(response)
                .context(ctx)
                .action(CallAction.provideOtp(message.getOtp(), spokenCompany, true))
                .intent(Intent.REQUESTING_OTP)
                .build();
    }
}

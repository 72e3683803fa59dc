package com.ai.echomi.conversation;

import java.util.Optional;

public enum DeliveryStage implements ConversationStage {
    START("start"),
    WAITING_FOR_CONTEXT("waiting_for_context"),
    ASKING_COMPANY_FIRST("asking_company_first"),
    ASKING_LOCATION_HELP("asking_location_help"),
    GETTING_CURRENT_LOCATION("getting_current_location"),
    TRAVELING_TO_LOCATION("traveling_to_location"),
    ASKING_COMPANY_FOR_OTP("asking_company_for_otp"),
    ASKING_IF_OTP_NEEDED("asking_if_otp_needed"),
    REQUESTING_SMS_OTP("requesting_sms_otp"),
    ASKING_OTP_COMPANY("asking_otp_company"),
    CHECKING_SMS("checking_sms"),
    CALL_ENDING("call_ending"),
    OTP_NOT_FOUND("otp_not_found"),
    MANUAL_OTP_ENTRY("manual_otp_entry"),
    CONFIRMING_MANUAL_OTP("confirming_manual_otp"),
    OTP_PROVIDED("otp_provided"),
    END_OF_CALL("end_of_call");

    private final String label;

    DeliveryStage(String label) {
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public CallerRole role() {
        return CallerRole.DELIVERY;
    }

    @Override
    public boolean isTerminal() {
        return this == CALL_ENDING || this == END_OF_CALL;
    }

    /** Stages where the caller is expected to read digits aloud. */
    public boolean expectsDigits() {
        return this == OTP_NOT_FOUND || this == MANUAL_OTP_ENTRY || this == CONFIRMING_MANUAL_OTP;
    }

    public static Optional<DeliveryStage> fromLabel(String label) {
        for (DeliveryStage stage : values()) {
            if (stage.label.equals(label)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}

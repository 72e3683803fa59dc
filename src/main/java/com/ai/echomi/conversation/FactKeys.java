package com.ai.echomi.conversation;

/**
 * Keys of the per-session fact map. They double as the wire names inside
 * {@code collected_info}.
 */
public final class FactKeys {

    public static final String NAME = "name";
    public static final String PHONE = "phone";
    public static final String COMPANY = "company";
    public static final String PURPOSE = "purpose";
    public static final String ORDER_ID = "order_id";
    public static final String CURRENT_LOCATION = "current_location";
    public static final String ADDITIONAL_DETAILS = "additional_details";
    public static final String FOLLOWUP_ASKED = "followup_asked";
    public static final String FOLLOWUP_PLAN = "followup_plan";
    public static final String FOLLOWUP_IMPORTANCE = "followup_importance";
    public static final String FOLLOWUP_SECOND_QUESTION = "followup_second_question";
    public static final String MANUAL_OTP = "manual_otp";
    public static final String LOCATION_ATTEMPTS = "location_attempts";
    public static final String NAME_ATTEMPTS = "name_attempts";

    private FactKeys() {
    }
}

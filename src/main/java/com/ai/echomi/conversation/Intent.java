package com.ai.echomi.conversation;

/**
 * Closed set of utterance tags produced by the intent classifier.
 */
public enum Intent {
    REQUESTING_OTP("requesting_otp"),
    PROVIDING_LOCATION("providing_location"),
    INITIAL_DELIVERY("initial_delivery"),
    NON_URGENT_CALLBACK("non_urgent_callback"),
    PROVIDE_SELF_NUMBER("provide_self_number"),
    REQUESTING_CALLBACK("requesting_callback"),
    GENERAL_YES("general_yes"),
    DECLINING("declining"),
    ENDING_CONVERSATION("ending_conversation"),
    GENERAL("general");

    private final String label;

    Intent(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

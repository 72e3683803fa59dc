package com.ai.echomi.conversation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Side effect requested by a conversation turn. The state machine only describes
 * the effect; the orchestrator and the caller carry it out.
 */
public final class CallAction {

    public enum Type {
        NONE,
        REQUEST_SMS_OTP,
        URGENT_NOTIFICATION,
        PROVIDE_OTP
    }

    private final Type type;
    private final Map<String, String> payload;
    private final boolean endCall;

    private CallAction(Type type, Map<String, String> payload, boolean endCall) {
        this.type = type;
        this.payload = payload == null ? Collections.emptyMap() : new LinkedHashMap<>(payload);
        this.endCall = endCall;
    }

    public Type getType() {
        return type;
    }

    public boolean isEndCall() {
        return endCall;
    }

    public String getString(String key) {
        return payload.get(key);
    }

    public String getCompany() {
        return payload.get("company");
    }

    public String getMessage() {
        return payload.get("message");
    }

    public String getOtp() {
        return payload.get("otp");
    }

    public CallAction withEndCall(boolean endCall) {
        return new CallAction(type, payload, endCall);
    }

    public static CallAction none() {
        return new CallAction(Type.NONE, null, false);
    }

    public static CallAction endOfCall() {
        return new CallAction(Type.NONE, null, true);
    }

    public static CallAction requestSmsOtp(String company) {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("company", company);
        return new CallAction(Type.REQUEST_SMS_OTP, p, false);
    }

    public static CallAction urgentNotification(String message) {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("message", message);
        return new CallAction(Type.URGENT_NOTIFICATION, p, true);
    }

    public static CallAction provideOtp(String otp, String company, boolean endCall) {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("otp", otp);
        p.put("company", company);
        return new CallAction(Type.PROVIDE_OTP, p, endCall);
    }

    @JsonValue
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type.name());
        wire.putAll(payload);
        wire.put("end_call", endCall);
        return wire;
    }

    @Override
    public String toString() {
        return "CallAction" + toWire();
    }
}

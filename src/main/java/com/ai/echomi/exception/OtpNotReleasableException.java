package com.ai.echomi.exception;

/**
 * The order exists but its OTP may not be handed out yet.
 */
public class OtpNotReleasableException extends RuntimeException {

    public OtpNotReleasableException(String message) {
        super(message);
    }
}

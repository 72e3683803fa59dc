package com.ai.echomi.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * What the OTP extraction engine made of one SMS body.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ParsedMessage {

    private final String rawText;

    private final String sender;

    private final String otp;

    private final String trackingId;

    private final String company;

    private final double confidence;

    private final String timestamp;

    public boolean hasOtp() {
        return otp != null && !otp.isEmpty();
    }
}

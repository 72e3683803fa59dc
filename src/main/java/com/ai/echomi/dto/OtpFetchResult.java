package com.ai.echomi.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * OTP returned by the OTP backend. {@code fallback} marks a synthetic placeholder
 * produced when the backend could not be reached.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OtpFetchResult {

    private final String otp;

    private final String company;

    private final String orderId;

    private final boolean fallback;

    private final String error;
}

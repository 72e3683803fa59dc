package com.ai.echomi.client;

import com.ai.echomi.dto.OtpFetchResult;

final class PlaceholderOtp {

    static final String VALUE = "123456";

    private PlaceholderOtp() {
    }

    static OtpFetchResult of(String company, String orderId, String error) {
        return OtpFetchResult.builder()
                .otp(VALUE)
                .company(company)
                .orderId(orderId)
                .fallback(true)
                .error(error)
                .build();
    }
}

package com.ai.echomi.client;

import com.ai.echomi.dto.OtpFetchResult;

/**
 * Source of the OTP for an order when the ledger does not already hold one.
 */
public interface OtpBackendClient {

    /**
     * Never throws; an unreachable backend yields a result with {@code fallback} set.
     */
    OtpFetchResult fetchOtp(String userId, String company, String orderId);
}

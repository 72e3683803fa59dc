package com.ai.echomi.client;

import com.ai.echomi.dto.OtpFetchResult;
import com.ai.echomi.entity.OrderRecord;
import com.ai.echomi.service.OrderLedger;

import java.util.Optional;

/**
 * Mock-mode OTP source: answers from the in-memory ledger, or with a marked
 * placeholder when the order carries no OTP.
 */
public class LedgerOtpBackendClient implements OtpBackendClient {

    private final OrderLedger ledger;

    public LedgerOtpBackendClient(OrderLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public OtpFetchResult fetchOtp(String userId, String company, String orderId) {
        Optional<OrderRecord> order = ledger.get(orderId).filter(OrderRecord::hasOtp);
        if (order.isEmpty()) {
            return PlaceholderOtp.of(company, orderId, "No stored OTP");
        }
        return OtpFetchResult.builder()
                .otp(order.get().getOtp())
                .company(order.get().getCompany())
                .orderId(orderId)
                .fallback(false)
                .build();
    }
}

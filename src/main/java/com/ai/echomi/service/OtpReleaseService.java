package com.ai.echomi.service;

import com.ai.echomi.client.OtpBackendClient;
import com.ai.echomi.dto.OtpFetchResult;
import com.ai.echomi.dto.OtpReleaseRequest;
import com.ai.echomi.entity.OrderRecord;
import com.ai.echomi.entity.OrderStatus;
import com.ai.echomi.exception.OrderNotFoundException;
import com.ai.echomi.exception.OtpNotReleasableException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hands the OTP of an owner-approved order to the mobile app and closes the order.
 */
@Service
public class OtpReleaseService {

    private static final Logger log = LoggerFactory.getLogger(OtpReleaseService.class);

    private final OrderLedger orderLedger;
    private final OtpBackendClient otpBackend;

    public OtpReleaseService(OrderLedger orderLedger, OtpBackendClient otpBackend) {
        this.orderLedger = orderLedger;
        this.otpBackend = otpBackend;
    }

    public OtpFetchResult release(OtpReleaseRequest request) {
        if (request == null || StringUtils.isBlank(request.getOrderId())) {
            throw new IllegalArgumentException("orderId is required");
        }
        String orderId = request.getOrderId().trim();
        OrderRecord order = orderLedger.get(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
        if (order.getStatus() != OrderStatus.APPROVED) {
            throw new OtpNotReleasableException("The delivery hasn't been approved yet.");
        }

        String company = StringUtils.defaultIfBlank(request.getCompany(), order.getCompany());
        boolean fallback = false;
        String supplied = null;
        if (!order.hasOtp()) {
            OtpFetchResult fetched = otpBackend.fetchOtp(request.getFirebaseUid(), company, orderId);
            fallback = fetched.isFallback();
            supplied = fetched.getOtp();
            if (fallback) {
                log.warn("Order {} released with a placeholder OTP: {}", orderId, fetched.getError());
            }
        }
        String otp = orderLedger.releaseOtp(orderId, supplied);
        return OtpFetchResult.builder()
                .otp(otp)
                .company(order.getCompany())
                .orderId(orderId)
                .fallback(fallback)
                .build();
    }
}

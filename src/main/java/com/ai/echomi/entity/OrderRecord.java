package com.ai.echomi.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A delivery order known to the ledger. Instances are immutable snapshots; the
 * ledger replaces them on every change.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "otp")
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderRecord {

    private final String orderId;

    private final String company;

    /** Only handed out through the OTP release endpoint. */
    @JsonIgnore
    private final String otp;

    private final String trackingId;

    private final OrderStatus status;

    private final Instant createdAt;

    private final Instant updatedAt;

    public boolean hasOtp() {
        return otp != null && !otp.isBlank();
    }
}

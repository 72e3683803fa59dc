package com.ai.echomi.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Body of {@code POST /api/get-otp}; field names follow the mobile app's camelCase.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class OtpReleaseRequest {

    private String firebaseUid;

    private String company;

    private String orderId;
}

package com.ai.echomi.controller;

import com.ai.echomi.auth.SharedSecretVerifier;
import com.ai.echomi.dto.AddOrderRequest;
import com.ai.echomi.dto.OrderStatusRequest;
import com.ai.echomi.dto.OtpFetchResult;
import com.ai.echomi.dto.OtpReleaseRequest;
import com.ai.echomi.entity.OrderRecord;
import com.ai.echomi.entity.OrderStatus;
import com.ai.echomi.exception.OrderNotFoundException;
import com.ai.echomi.service.OrderLedger;
import com.ai.echomi.service.OtpReleaseService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Order management for the owner's app: register expected deliveries, approve or
 * deny them, and release the OTP of an approved one.
 */
@RestController
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final OrderLedger orderLedger;
    private final OtpReleaseService otpReleaseService;
    private final SharedSecretVerifier secretVerifier;

    public OrderController(OrderLedger orderLedger, OtpReleaseService otpReleaseService,
                           SharedSecretVerifier secretVerifier) {
        this.orderLedger = orderLedger;
        this.otpReleaseService = otpReleaseService;
        this.secretVerifier = secretVerifier;
    }

    @PostMapping("/add-order")
    public Map<String, Object> addOrder(@RequestBody AddOrderRequest request) {
        secretVerifier.verify(request.getSecretKey());
        if (StringUtils.isAnyBlank(request.getCompany(), request.getOtp())) {
            throw new IllegalArgumentException("company and otp are required");
        }
        String orderId = orderLedger.add(request.getCompany(), request.getOtp(), request.getTrackingId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("order_id", orderId);
        return body;
    }

    @GetMapping("/list-orders")
    public Map<String, Object> listOrders() {
        List<OrderRecord> orders = orderLedger.list();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("orders", orders);
        body.put("count", orders.size());
        return body;
    }

    @GetMapping("/api/orders/{orderId}")
    public OrderRecord getOrder(@PathVariable String orderId) {
        return orderLedger.get(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @PostMapping("/api/orders/{orderId}/status")
    public OrderRecord setStatus(@PathVariable String orderId, @RequestBody OrderStatusRequest request) {
        secretVerifier.verify(request.getSecretKey());
        OrderStatus next = OrderStatus.fromLabel(request.getStatus())
                .orElseThrow(() -> new IllegalArgumentException("Unknown status: " + request.getStatus()));
        OrderRecord updated = orderLedger.setStatus(orderId, next);
        log.info("Order {} is now {}", orderId, updated.getStatus().label());
        return updated;
    }

    @PostMapping("/api/get-otp")
    public Map<String, Object> getOtp(@RequestBody OtpReleaseRequest request) {
        OtpFetchResult released = otpReleaseService.release(request);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("otp", released.getOtp());
        body.put("company", released.getCompany());
        body.put("order_id", released.getOrderId());
        body.put("fallback", released.isFallback());
        return body;
    }
}

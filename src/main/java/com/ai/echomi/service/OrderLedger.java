package com.ai.echomi.service;

import com.ai.echomi.entity.OrderRecord;
import com.ai.echomi.entity.OrderStatus;
import com.ai.echomi.exception.IllegalOrderTransitionException;
import com.ai.echomi.exception.OrderNotFoundException;
import com.ai.echomi.exception.OtpNotReleasableException;
import com.ai.echomi.utils.TextUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory registry of delivery orders. One lock guards every read-modify-write,
 * so two concurrent status changes on the same order are applied one after the
 * other and the second one sees the result of the first.
 */
@Service
public class OrderLedger {

    private static final Logger log = LoggerFactory.getLogger(OrderLedger.class);

    private final Map<String, OrderRecord> orders = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public OrderLedger() {
        this(Clock.systemUTC());
    }

    OrderLedger(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a new pending order. Company is title-cased; the tracking id is
     * stored upper-case without spaces.
     */
    public String add(String company, String otp, String trackingId) {
        if (StringUtils.isBlank(company)) {
            throw new IllegalArgumentException("company is required");
        }
        Instant now = clock.instant();
        OrderRecord order = OrderRecord.builder()
                .orderId(UUID.randomUUID().toString())
                .company(TextUtils.titleCase(company.trim()))
                .otp(TextUtils.nullIfEmpty(otp))
                .trackingId(normalizeTrackingId(trackingId))
                .status(OrderStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        lock.lock();
        try {
            orders.put(order.getOrderId(), order);
        } finally {
            lock.unlock();
        }
        log.info("Order {} added for {}", order.getOrderId(), order.getCompany());
        return order.getOrderId();
    }

    public Optional<OrderRecord> get(String orderId) {
        if (orderId == null) return Optional.empty();
        lock.lock();
        try {
            return Optional.ofNullable(orders.get(orderId));
        } finally {
            lock.unlock();
        }
    }

    public List<OrderRecord> list() {
        lock.lock();
        try {
            List<OrderRecord> all = new ArrayList<>(orders.values());
            all.sort(Comparator.comparing(OrderRecord::getCreatedAt));
            return all;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a status change. Re-applying the current status is a no-op; any move
     * the status table does not allow is rejected.
     */
    public OrderRecord setStatus(String orderId, OrderStatus next) {
        lock.lock();
        try {
            OrderRecord current = require(orderId);
            if (current.getStatus() == next) {
                return current;
            }
            if (!current.getStatus().canMoveTo(next)) {
                throw new IllegalOrderTransitionException(orderId, current.getStatus(), next);
            }
            OrderRecord updated = current.toBuilder().status(next).updatedAt(clock.instant()).build();
            orders.put(orderId, updated);
            log.info("Order {} {} -> {}", orderId, current.getStatus().label(), next.label());
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands out the OTP of an approved order and completes it in the same step.
     * {@code suppliedOtp} is used only when the order has none stored.
     */
    public String releaseOtp(String orderId, String suppliedOtp) {
        lock.lock();
        try {
            OrderRecord current = require(orderId);
            if (current.getStatus() != OrderStatus.APPROVED) {
                throw new OtpNotReleasableException("The delivery hasn't been approved yet.");
            }
            String otp = current.hasOtp() ? current.getOtp() : TextUtils.nullIfEmpty(suppliedOtp);
            if (otp == null) {
                throw new OtpNotReleasableException("No OTP is available for this order.");
            }
            orders.put(orderId, current.toBuilder()
                    .otp(otp)
                    .status(OrderStatus.COMPLETED)
                    .updatedAt(clock.instant())
                    .build());
            log.info("Order {} OTP released, order completed", orderId);
            return otp;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Completes an approved order with the OTP found for it. Orders in any other
     * status are left untouched.
     */
    public boolean recordDelivery(String orderId, String otp) {
        if (orderId == null) return false;
        lock.lock();
        try {
            OrderRecord current = orders.get(orderId);
            if (current == null || current.getStatus() != OrderStatus.APPROVED) {
                return false;
            }
            orders.put(orderId, current.toBuilder()
                    .otp(current.hasOtp() ? current.getOtp() : otp)
                    .status(OrderStatus.COMPLETED)
                    .updatedAt(clock.instant())
                    .build());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private OrderRecord require(String orderId) {
        OrderRecord order = orderId == null ? null : orders.get(orderId);
        if (order == null) {
            throw new OrderNotFoundException(orderId);
        }
        return order;
    }

    static String normalizeTrackingId(String trackingId) {
        if (StringUtils.isBlank(trackingId)) return null;
        return StringUtils.deleteWhitespace(trackingId).toUpperCase();
    }
}

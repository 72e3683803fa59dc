package com.ai.echomi.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

public enum OrderStatus {
    PENDING("pending"),
    APPROVED("approved"),
    COMPLETED("completed"),
    DENIED("denied");

    private final String label;

    OrderStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DENIED;
    }

    /**
     * pending -> approved | denied, approved -> completed. Terminal
     * statuses accept nothing.
     */
    public Set<OrderStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(APPROVED, DENIED);
            case APPROVED:
                return EnumSet.of(COMPLETED);
            default:
                return EnumSet.noneOf(OrderStatus.class);
        }
    }

    public boolean canMoveTo(OrderStatus next) {
        return allowedNext().contains(next);
    }

    public static Optional<OrderStatus> fromLabel(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase();
        for (OrderStatus status : values()) {
            if (status.label.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}

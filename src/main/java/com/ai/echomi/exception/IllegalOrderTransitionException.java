package com.ai.echomi.exception;

import com.ai.echomi.entity.OrderStatus;

public class IllegalOrderTransitionException extends RuntimeException {

    private final OrderStatus from;
    private final OrderStatus to;

    public IllegalOrderTransitionException(String orderId, OrderStatus from, OrderStatus to) {
        super("Order " + orderId + " cannot move from " + from.label() + " to " + to.label());
        this.from = from;
        this.to = to;
    }

    public OrderStatus getFrom() {
        return from;
    }

    public OrderStatus getTo() {
        return to;
    }
}

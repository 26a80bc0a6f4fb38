package com.kalshi.bot.error;

import com.kalshi.bot.domain.OrderStatus;

public class IllegalOrderTransitionException extends TradingException {

    public IllegalOrderTransitionException(String clientOrderId, OrderStatus from, OrderStatus to) {
        super("Order " + clientOrderId + " cannot move from " + from + " to " + to);
    }

    public IllegalOrderTransitionException(String message) {
        super(message);
    }
}

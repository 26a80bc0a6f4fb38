package com.kalshi.bot.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Exchange view of an order: cumulative fills and the exchange-side status.
 */
@Value
@Builder
public class OrderStatusReport {
    String orderId;
    OrderStatus status;
    int filledQuantity;
    BigDecimal averageFillPrice; // cents, null when the exchange did not report fill cost
}

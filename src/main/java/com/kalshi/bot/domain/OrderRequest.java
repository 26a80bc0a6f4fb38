package com.kalshi.bot.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Limit order to submit. {@code clientOrderId} doubles as the idempotency key
 * both locally and on the exchange.
 */
@Value
public class OrderRequest {
    String clientOrderId;
    String marketId;
    Side side;
    OrderAction action;
    int priceCents;
    int quantity;

    @Builder
    public OrderRequest(String clientOrderId, String marketId, Side side, OrderAction action, int priceCents,
            int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive, got " + quantity);
        }
        if (priceCents < 1 || priceCents > 99) {
            throw new IllegalArgumentException("Price must be within 1-99 cents, got " + priceCents);
        }
        this.clientOrderId = Objects.requireNonNull(clientOrderId, "clientOrderId");
        this.marketId = Objects.requireNonNull(marketId, "marketId");
        this.side = Objects.requireNonNull(side, "side");
        this.action = Objects.requireNonNull(action, "action");
        this.priceCents = priceCents;
        this.quantity = quantity;
    }
}

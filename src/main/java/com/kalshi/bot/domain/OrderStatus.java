package com.kalshi.bot.domain;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Order states and the single table of legal transitions between them.
 *
 * <p>PARTIALLY_FILLED is not terminal by itself: an order that was cancelled
 * after a partial fill keeps this status and is closed through
 * {@link Order#finish}.
 */
public enum OrderStatus {
    SUBMITTING,
    PENDING,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    EXPIRED,
    REJECTED;

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(SUBMITTING, EnumSet.of(PENDING, PARTIALLY_FILLED, FILLED, REJECTED));
        TRANSITIONS.put(PENDING, EnumSet.of(PENDING, PARTIALLY_FILLED, FILLED, CANCELED, EXPIRED, REJECTED));
        TRANSITIONS.put(PARTIALLY_FILLED, EnumSet.of(PARTIALLY_FILLED, PENDING, FILLED));
        TRANSITIONS.put(FILLED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(CANCELED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(EXPIRED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(REJECTED, EnumSet.noneOf(OrderStatus.class));
    }

    public boolean canTransitionTo(OrderStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    /** True for states with no outgoing transitions. */
    public boolean isFinal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}

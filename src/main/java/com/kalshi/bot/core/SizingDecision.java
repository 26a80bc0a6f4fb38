package com.kalshi.bot.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Either a contract count at a limit price, or the reason no order should be
 * placed. Never a zero-contract size.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SizingDecision {
    int contracts;
    int priceCents;
    RejectionReason rejection;
    String detail;

    public static SizingDecision sized(int contracts, int priceCents) {
        if (contracts <= 0) {
            throw new IllegalArgumentException("A sized decision needs at least one contract");
        }
        return new SizingDecision(contracts, priceCents, null, null);
    }

    public static SizingDecision rejected(RejectionReason reason, String detail) {
        return new SizingDecision(0, 0, reason, detail);
    }

    public boolean isSized() {
        return rejection == null;
    }

    /** Committed capital in cents. */
    public BigDecimal notional() {
        return BigDecimal.valueOf((long) contracts * priceCents);
    }
}

package com.kalshi.bot.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * A market that passed the scanner's filters, captured at one point in time.
 * Consumed once per sizing decision.
 */
@Value
public class Opportunity {
    String marketId;
    Side side;
    int priceCents; // entry price, 1-99
    BigDecimal liquidityCents;
    long volume;
    Duration timeToClose;

    @Builder
    public Opportunity(String marketId, Side side, int priceCents, BigDecimal liquidityCents, long volume,
            Duration timeToClose) {
        if (priceCents < 1 || priceCents > 99) {
            throw new IllegalArgumentException("Price must be within 1-99 cents, got " + priceCents);
        }
        this.marketId = Objects.requireNonNull(marketId, "marketId");
        this.side = Objects.requireNonNull(side, "side");
        this.priceCents = priceCents;
        this.liquidityCents = Objects.requireNonNull(liquidityCents, "liquidityCents");
        this.volume = volume;
        this.timeToClose = Objects.requireNonNull(timeToClose, "timeToClose");
    }

    public BigDecimal probability() {
        return BigDecimal.valueOf(priceCents, 2);
    }
}

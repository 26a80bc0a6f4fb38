package com.kalshi.bot.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a binary market. Prices are integer cents, 0 when the
 * book has no quote on that side.
 */
@Value
@Builder
public class MarketSnapshot {
    String marketId;
    String eventId;
    String title;
    boolean open;
    int yesBid;
    int yesAsk;
    int noBid;
    int noAsk;
    int lastPrice; // last YES trade
    long volume;
    BigDecimal liquidityCents;
    Instant closeTime; // may be null for open-ended markets
    Instant lastUpdated;

    public boolean hasBids() {
        return yesBid > 0 || noBid > 0;
    }

    /**
     * Price a holder of {@code side} could sell at right now: the best bid on
     * that side, falling back to the last traded price. Null when neither exists.
     */
    public BigDecimal markFor(Side side) {
        int bid = side == Side.YES ? yesBid : noBid;
        if (bid > 0) {
            return BigDecimal.valueOf(bid);
        }
        if (lastPrice > 0) {
            return BigDecimal.valueOf(side == Side.YES ? lastPrice : 100 - lastPrice);
        }
        return null;
    }

    public Duration timeToClose(Instant now) {
        if (closeTime == null) {
            return Duration.ofDays(3650);
        }
        return Duration.between(now, closeTime);
    }
}

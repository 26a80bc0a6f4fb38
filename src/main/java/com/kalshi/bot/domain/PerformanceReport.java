package com.kalshi.bot.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Compounding statistics since the ledger was opened.
 */
@Value
@Builder
public class PerformanceReport {
    BigDecimal startingValue;
    BigDecimal currentValue;
    BigDecimal realizedPnl;
    int closedTrades;
    int winningTrades;

    public BigDecimal growthRate() {
        if (startingValue.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return currentValue.subtract(startingValue).divide(startingValue, 4, RoundingMode.HALF_EVEN);
    }

    public BigDecimal compoundMultiplier() {
        if (startingValue.signum() == 0) {
            return BigDecimal.ONE;
        }
        return currentValue.divide(startingValue, 4, RoundingMode.HALF_EVEN);
    }

    public BigDecimal winRate() {
        if (closedTrades == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(winningTrades).divide(BigDecimal.valueOf(closedTrades), 4, RoundingMode.HALF_EVEN);
    }

    public BigDecimal averageProfitPerTrade() {
        if (closedTrades == 0) {
            return BigDecimal.ZERO;
        }
        return realizedPnl.divide(BigDecimal.valueOf(closedTrades), 2, RoundingMode.HALF_EVEN);
    }
}

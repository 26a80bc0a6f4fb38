package com.kalshi.bot.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Consistent read of the ledger. All amounts in cents.
 */
@Value
@Builder
public class PortfolioSnapshot {
    BigDecimal cash;
    BigDecimal costBasis;
    BigDecimal unrealizedPnl;
    BigDecimal realizedPnl;
    BigDecimal feesPaid;
    BigDecimal baselineValue; // portfolio value when the ledger was opened
    int openPositions;
    Instant takenAt;

    public BigDecimal totalValue() {
        return cash.add(costBasis).add(unrealizedPnl);
    }
}

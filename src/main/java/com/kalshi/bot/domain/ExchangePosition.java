package com.kalshi.bot.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A holding as the exchange reports it, used to rebuild the ledger after a
 * restart.
 */
@Value
@Builder
public class ExchangePosition {
    String marketId;
    Side side;
    int quantity;
    BigDecimal costCents; // total paid for the contracts held
}

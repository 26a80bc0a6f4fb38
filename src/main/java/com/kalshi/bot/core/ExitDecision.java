package com.kalshi.bot.core;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class ExitDecision {
    ExitReason reason;
    int priceCents; // limit price for the closing order
    BigDecimal pnlPercent;
}

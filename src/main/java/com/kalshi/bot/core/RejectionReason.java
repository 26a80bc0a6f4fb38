package com.kalshi.bot.core;

public enum RejectionReason {
    CAP_REACHED,
    PRICE_ABOVE_CAP,
    INSUFFICIENT_FUNDS,
    BELOW_MIN_CONTRACTS
}

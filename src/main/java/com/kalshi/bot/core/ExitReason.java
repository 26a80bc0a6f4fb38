package com.kalshi.bot.core;

public enum ExitReason {
    PROFIT_TARGET,
    STOP_LOSS
}

package com.kalshi.bot.core;

/**
 * Which exit wins when profit target and stop-loss both trigger on the same
 * evaluation (possible only with overlapping thresholds or stale marks).
 */
public enum ExitPrecedence {
    PROFIT_TARGET_FIRST,
    STOP_LOSS_FIRST
}

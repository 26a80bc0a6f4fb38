package com.kalshi.bot.core;

/** Outcome of asking the ledger for the right to enter a market. */
public enum EntryClaim {
    CLAIMED,
    MARKET_BUSY, // position or entry order already exists
    CAP_REACHED,
    HALTED
}

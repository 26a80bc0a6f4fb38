package com.kalshi.bot.domain;

public enum Side {
    YES, NO;

    /** Lower-case wire value used by the exchange. */
    public String wireValue() {
        return name().toLowerCase();
    }
}

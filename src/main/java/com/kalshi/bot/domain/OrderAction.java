package com.kalshi.bot.domain;

public enum OrderAction {
    BUY, SELL;

    public String wireValue() {
        return name().toLowerCase();
    }
}

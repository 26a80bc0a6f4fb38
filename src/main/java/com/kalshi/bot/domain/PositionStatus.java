package com.kalshi.bot.domain;

public enum PositionStatus {
    OPEN,
    CLOSING, // exit order in flight
    CLOSED
}

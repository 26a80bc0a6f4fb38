package com.kalshi.bot.domain;

import lombok.Value;

/** Published when a position's last contracts were sold. */
@Value
public class PositionClosedEvent {
    Position position;
}

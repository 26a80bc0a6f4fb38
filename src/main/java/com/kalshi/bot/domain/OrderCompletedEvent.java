package com.kalshi.bot.domain;

import lombok.Value;

/** Published once per order after it reached a terminal state and was reconciled. */
@Value
public class OrderCompletedEvent {
    Order order;
}

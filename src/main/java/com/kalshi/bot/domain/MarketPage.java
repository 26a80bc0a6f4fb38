package com.kalshi.bot.domain;

import lombok.Value;

import java.util.List;

@Value
public class MarketPage {
    List<MarketSnapshot> markets;
    String cursor; // null or empty on the last page

    public boolean hasNext() {
        return cursor != null && !cursor.isEmpty();
    }
}

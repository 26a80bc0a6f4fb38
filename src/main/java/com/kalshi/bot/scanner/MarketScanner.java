package com.kalshi.bot.scanner;

import com.kalshi.bot.domain.Opportunity;

import java.util.stream.Stream;

/**
 * Source of entry candidates. Each call starts a fresh scan; the stream is
 * lazy, so callers can act on the first opportunity before later pages are
 * fetched, and must close it.
 */
public interface MarketScanner {

    Stream<Opportunity> scan();
}

package com.kalshi.bot.scanner;

import com.kalshi.bot.config.TradingProperties;
import com.kalshi.bot.domain.MarketSnapshot;
import com.kalshi.bot.domain.Opportunity;
import com.kalshi.bot.domain.Side;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * High-probability filter: YES side only, priced inside
 * [minProbability, maxProbability], with bids, enough volume and liquidity,
 * and closing inside the scan horizon.
 */
@Slf4j
@Component
public class MarketCriteria {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final TradingProperties.Scanner settings;
    private final Clock clock;

    public MarketCriteria(TradingProperties properties, Clock clock) {
        this.settings = properties.getScanner();
        this.clock = clock;
    }

    /**
     * Checks that need nothing beyond the listing data. Probability passes if
     * either the bid or the ask is in range, since wide spreads are common.
     */
    private boolean quickFilter(MarketSnapshot market) {
        if (!market.isOpen() || !market.hasBids()) {
            return false;
        }
        if (settings.getMinVolume() > 0 && market.getVolume() < settings.getMinVolume()) {
            log.debug("{} volume {} below {}", market.getMarketId(), market.getVolume(), settings.getMinVolume());
            return false;
        }
        if (!closesInsideHorizon(market)) {
            return false;
        }
        return inRange(market.getYesBid()) || inRange(market.getYesAsk());
    }

    /**
     * Full evaluation. The entry price is the YES ask, and it must itself sit
     * inside the probability range.
     */
    public Optional<Opportunity> evaluate(MarketSnapshot market) {
        if (!quickFilter(market)) {
            return Optional.empty();
        }

        BigDecimal liquidity = liquidityOf(market);
        if (liquidity.compareTo(settings.getMinLiquidityCents()) < 0) {
            log.debug("{} liquidity {}c below {}c", market.getMarketId(), liquidity, settings.getMinLiquidityCents());
            return Optional.empty();
        }

        int entryPrice = market.getYesAsk();
        if (entryPrice < 1 || entryPrice > 99 || !inRange(entryPrice)) {
            log.debug("{} ask {}c outside probability range", market.getMarketId(), entryPrice);
            return Optional.empty();
        }

        Instant now = clock.instant();
        return Optional.of(Opportunity.builder()
                .marketId(market.getMarketId())
                .side(Side.YES)
                .priceCents(entryPrice)
                .liquidityCents(liquidity)
                .volume(market.getVolume())
                .timeToClose(market.timeToClose(now))
                .build());
    }

    /** Reported liquidity, or volume times the mid of the two bids when none is reported. */
    BigDecimal liquidityOf(MarketSnapshot market) {
        BigDecimal reported = market.getLiquidityCents();
        if (reported != null && reported.signum() > 0) {
            return reported;
        }
        BigDecimal mid = BigDecimal.valueOf(market.getYesBid() + market.getNoBid()).divide(TWO);
        return mid.multiply(BigDecimal.valueOf(market.getVolume()));
    }

    private boolean closesInsideHorizon(MarketSnapshot market) {
        if (market.getCloseTime() == null) {
            return settings.getMaxHoursUntilClose() <= 0;
        }
        Duration remaining = market.timeToClose(clock.instant());
        if (remaining.isNegative() || remaining.isZero()) {
            return false;
        }
        return settings.getMaxHoursUntilClose() <= 0
                || remaining.compareTo(Duration.ofHours(settings.getMaxHoursUntilClose())) <= 0;
    }

    private boolean inRange(int priceCents) {
        if (priceCents <= 0) {
            return false;
        }
        BigDecimal probability = BigDecimal.valueOf(priceCents, 2);
        return probability.compareTo(settings.getMinProbability()) >= 0
                && probability.compareTo(settings.getMaxProbability()) <= 0;
    }
}

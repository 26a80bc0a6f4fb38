package com.kalshi.bot.scanner;

import com.kalshi.bot.config.TradingProperties;
import com.kalshi.bot.core.ExchangeChannel;
import com.kalshi.bot.domain.MarketPage;
import com.kalshi.bot.domain.MarketSnapshot;
import com.kalshi.bot.domain.Opportunity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pages through open markets on demand and yields those passing
 * {@link MarketCriteria}, at most one per event so both sides of the same
 * game are never bought in one scan.
 */
@Slf4j
@Component
public class KalshiMarketScanner implements MarketScanner {

    private final ExchangeChannel channel;
    private final MarketCriteria criteria;
    private final TradingProperties.Scanner settings;

    public KalshiMarketScanner(ExchangeChannel channel, MarketCriteria criteria, TradingProperties properties) {
        this.channel = channel;
        this.criteria = criteria;
        this.settings = properties.getScanner();
    }

    @Override
    public Stream<Opportunity> scan() {
        log.info("Scanning markets (prob {}-{}, min volume {}, closes within {}h)", settings.getMinProbability(),
                settings.getMaxProbability(), settings.getMinVolume(), settings.getMaxHoursUntilClose());
        PagingIterator pages = new PagingIterator();
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED), false)
                .onClose(pages::logSummary);
    }

    private class PagingIterator implements Iterator<Opportunity> {

        private final Deque<MarketSnapshot> buffer = new ArrayDeque<>();
        private final Set<String> seenEvents = new HashSet<>();
        private String cursor;
        private int pagesFetched;
        private boolean exhausted;
        private int checked;
        private int found;
        private Opportunity next;

        @Override
        public boolean hasNext() {
            while (next == null) {
                MarketSnapshot market = nextMarket();
                if (market == null) {
                    return false;
                }
                checked++;
                String eventId = market.getEventId();
                boolean hasEvent = eventId != null && !eventId.isEmpty();
                if (hasEvent && seenEvents.contains(eventId)) {
                    continue;
                }
                Optional<Opportunity> opportunity = criteria.evaluate(market);
                if (opportunity.isPresent()) {
                    if (hasEvent) {
                        seenEvents.add(eventId);
                    }
                    found++;
                    next = opportunity.get();
                    log.info("Found opportunity: {} YES @ {}c (vol {}, liquidity {}c)", next.getMarketId(),
                            next.getPriceCents(), next.getVolume(), next.getLiquidityCents());
                }
            }
            return true;
        }

        @Override
        public Opportunity next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Opportunity result = next;
            next = null;
            return result;
        }

        private MarketSnapshot nextMarket() {
            while (buffer.isEmpty()) {
                if (exhausted || pagesFetched >= settings.getMaxPages()) {
                    return null;
                }
                MarketPage page = channel.listMarkets(cursor, settings.getPageSize());
                pagesFetched++;
                buffer.addAll(page.getMarkets());
                cursor = page.getCursor();
                exhausted = !page.hasNext() || page.getMarkets().isEmpty();
            }
            return buffer.poll();
        }

        void logSummary() {
            log.info("Scan finished: {} pages, {} markets checked, {} opportunities", pagesFetched, checked, found);
        }
    }
}

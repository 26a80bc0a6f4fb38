package com.kalshi.bot.core;

import com.kalshi.bot.config.TradingProperties;
import com.kalshi.bot.domain.Opportunity;
import com.kalshi.bot.domain.Order;
import com.kalshi.bot.domain.OrderAction;
import com.kalshi.bot.domain.OrderRequest;
import com.kalshi.bot.domain.OrderStatus;
import com.kalshi.bot.error.LedgerInvariantViolationException;
import com.kalshi.bot.error.RateGateTimeoutException;
import com.kalshi.bot.scanner.MarketScanner;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Drives the entry side of the bot: scans, claims, sizes and places entries
 * on a fixed delay, and hands filled positions to the {@link PositionMonitor}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingOrchestrator {

    private final MarketScanner scanner;
    private final PositionSizer sizer;
    private final PortfolioLedger ledger;
    private final OrderLifecycleManager lifecycleManager;
    private final PositionMonitor monitor;
    private final ShutdownSignal shutdownSignal;
    private final TradingProperties properties;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicLong entrySequence = new AtomicLong(System.currentTimeMillis());

    @Scheduled(fixedDelayString = "${trading.scan-interval:PT60S}", initialDelayString = "${trading.initial-delay:PT5S}")
    public void runCycle() {
        if (!cycleLock.tryLock()) {
            log.warn("Previous cycle still running, skipping");
            return;
        }
        try {
            if (shutdownSignal.isTriggered()) {
                return;
            }
            if (ledger.isHalted()) {
                log.error("Ledger halted, not trading: {}", ledger.getHaltReason());
                return;
            }
            monitor.syncWithLedger();
            int entered = scanAndEnter();
            log.info("Cycle done: {} new entries, {} positions open", entered, ledger.openPositions().size());
        } catch (RuntimeException e) {
            log.error("Trading cycle failed", e);
        } finally {
            cycleLock.unlock();
        }
    }

    private int scanAndEnter() {
        int entered = 0;
        try (Stream<Opportunity> opportunities = scanner.scan()) {
            Iterator<Opportunity> it = opportunities.iterator();
            while (it.hasNext() && !shutdownSignal.isTriggered()) {
                EntryOutcome outcome = tryEnter(it.next());
                if (outcome == EntryOutcome.ENTERED) {
                    entered++;
                } else if (outcome == EntryOutcome.STOP) {
                    break;
                }
            }
        }
        return entered;
    }

    enum EntryOutcome { ENTERED, SKIPPED, STOP }

    EntryOutcome tryEnter(Opportunity opportunity) {
        String marketId = opportunity.getMarketId();
        if (opportunity.getTimeToClose().compareTo(properties.getEntryCutoff()) < 0) {
            log.debug("[ENTRY] {} closes in {}, inside the entry cutoff", marketId, opportunity.getTimeToClose());
            return EntryOutcome.SKIPPED;
        }

        EntryClaim claim = ledger.tryClaimEntry(marketId, properties.getMaxConcurrentPositions());
        switch (claim) {
            case HALTED:
                log.error("[ENTRY] Ledger halted, stopping entries: {}", ledger.getHaltReason());
                return EntryOutcome.STOP;
            case CAP_REACHED:
                log.info("[ENTRY] Max concurrent positions ({}) reached", properties.getMaxConcurrentPositions());
                return EntryOutcome.STOP;
            case MARKET_BUSY:
                return EntryOutcome.SKIPPED;
            default:
                break;
        }

        try {
            SizingDecision decision = sizer.size(ledger.snapshot(), opportunity);
            if (!decision.isSized()) {
                ledger.releaseEntry(marketId);
                log.info("[ENTRY] {} not sized: {} ({})", marketId, decision.getRejection(), decision.getDetail());
                return EntryOutcome.SKIPPED;
            }

            OrderRequest request = OrderRequest.builder()
                    .clientOrderId("entry-" + marketId + "-" + entrySequence.incrementAndGet())
                    .marketId(marketId)
                    .side(opportunity.getSide())
                    .action(OrderAction.BUY)
                    .priceCents(decision.getPriceCents())
                    .quantity(decision.getContracts())
                    .build();
            log.info("[ENTRY] {} {} x{} @ {}c (prob {}, vol {})", marketId, opportunity.getSide(),
                    decision.getContracts(), decision.getPriceCents(), opportunity.probability(),
                    opportunity.getVolume());

            Order order = lifecycleManager.placeAndTrack(request, properties.getOrders().getEntryTimeout());
            if (order.getFilledQuantity() > 0) {
                monitor.track(marketId);
                return EntryOutcome.ENTERED;
            }
            if (order.getStatus() == OrderStatus.REJECTED) {
                log.warn("[ENTRY] {} rejected: {}", marketId, order.getFailureReason());
            }
            return EntryOutcome.SKIPPED;
        } catch (LedgerInvariantViolationException e) {
            log.error("[ENTRY] Ledger invariant violated on {}, stopping entries", marketId, e);
            return EntryOutcome.STOP;
        } catch (RateGateTimeoutException e) {
            ledger.releaseEntry(marketId);
            log.warn("[ENTRY] {} skipped, rate gate busy: {}", marketId, e.getMessage());
            return EntryOutcome.SKIPPED;
        } catch (RuntimeException e) {
            ledger.releaseEntry(marketId);
            log.error("[ENTRY] Failed to enter {}", marketId, e);
            return EntryOutcome.SKIPPED;
        }
    }

    /**
     * Signals shutdown, waits for the running cycle to give up its in-flight
     * entry, then stops the monitor.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutdown requested, cancelling in-flight orders");
        shutdownSignal.trigger();
        cycleLock.lock();
        try {
            monitor.shutdown();
        } finally {
            cycleLock.unlock();
        }
        log.info("Shutdown complete: {} positions still open", ledger.openPositions().size());
    }
}

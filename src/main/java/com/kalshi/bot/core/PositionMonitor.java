package com.kalshi.bot.core;

import com.kalshi.bot.config.TradingProperties;
import com.kalshi.bot.domain.MarketSnapshot;
import com.kalshi.bot.domain.Order;
import com.kalshi.bot.domain.OrderAction;
import com.kalshi.bot.domain.OrderRequest;
import com.kalshi.bot.domain.Position;
import com.kalshi.bot.domain.PositionStatus;
import com.kalshi.bot.error.LedgerInvariantViolationException;
import com.kalshi.bot.error.RateGateTimeoutException;
import com.kalshi.bot.error.TransientChannelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Watches every open position on its own fixed-delay task and closes it when
 * the {@link ExitPolicy} fires.
 *
 * <p>Tasks share a pool, and each market fetch is bounded by its own timeout,
 * so a slow response on one market does not hold up the others. Exit orders
 * are tracked on a separate unbounded pool so a resting exit never occupies a
 * monitor thread; the position stays CLOSING until its exit is booked. Exits
 * always cover the full remaining quantity; whatever is left after a partial
 * exit is looked at again on the next tick.
 */
@Slf4j
@Service
public class PositionMonitor {

    private final PortfolioLedger ledger;
    private final ExchangeChannel channel;
    private final ExitPolicy exitPolicy;
    private final OrderLifecycleManager lifecycleManager;
    private final ShutdownSignal shutdownSignal;
    private final TradingProperties.Monitor settings;
    private final Duration exitTimeout;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService fetchExecutor;
    private final ExecutorService exitExecutor;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();
    private final AtomicLong exitSequence = new AtomicLong(System.currentTimeMillis());

    public PositionMonitor(PortfolioLedger ledger, ExchangeChannel channel, ExitPolicy exitPolicy,
            OrderLifecycleManager lifecycleManager, ShutdownSignal shutdownSignal, TradingProperties properties) {
        this.ledger = ledger;
        this.channel = channel;
        this.exitPolicy = exitPolicy;
        this.lifecycleManager = lifecycleManager;
        this.shutdownSignal = shutdownSignal;
        this.settings = properties.getMonitor();
        this.exitTimeout = properties.getOrders().getExitTimeout();
        this.scheduler = Executors.newScheduledThreadPool(settings.getThreads(), namedThreads("position-monitor"));
        this.fetchExecutor = Executors.newCachedThreadPool(namedThreads("market-fetch"));
        this.exitExecutor = Executors.newCachedThreadPool(namedThreads("position-exit"));
    }

    /** Starts a monitoring task for {@code marketId} unless one is running. */
    public void track(String marketId) {
        if (shutdownSignal.isTriggered()) {
            return;
        }
        tasks.computeIfAbsent(marketId, id -> {
            log.info("[MONITOR] Watching {} every {}s", id, settings.getCadence().toSeconds());
            long cadenceMillis = settings.getCadence().toMillis();
            return scheduler.scheduleWithFixedDelay(() -> tick(id), cadenceMillis, cadenceMillis,
                    TimeUnit.MILLISECONDS);
        });
    }

    public void untrack(String marketId) {
        ScheduledFuture<?> task = tasks.remove(marketId);
        if (task != null) {
            task.cancel(false);
            log.info("[MONITOR] Stopped watching {}", marketId);
        }
    }

    /** Aligns running tasks with the ledger's open positions. */
    public void syncWithLedger() {
        Set<String> open = ledger.openPositions().stream()
                .map(Position::getMarketId)
                .collect(Collectors.toSet());
        open.forEach(this::track);
        tasks.keySet().stream()
                .filter(marketId -> !open.contains(marketId))
                .toList()
                .forEach(this::untrack);
    }

    public Set<String> trackedMarkets() {
        return Set.copyOf(tasks.keySet());
    }

    private void tick(String marketId) {
        if (shutdownSignal.isTriggered()) {
            return;
        }
        try {
            checkPosition(marketId);
        } catch (LedgerInvariantViolationException e) {
            log.error("[MONITOR] Ledger invariant violated while handling {}: {}", marketId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[MONITOR] Check failed for {}", marketId, e);
        }
    }

    /**
     * One evaluation: refresh the mark, ask the exit policy, and start closing
     * the position if it fires.
     *
     * @return the exit order being worked, if this check started one
     */
    public Optional<CompletableFuture<Order>> checkPosition(String marketId) {
        Optional<Position> current = ledger.position(marketId);
        if (current.isEmpty()) {
            untrack(marketId);
            return Optional.empty();
        }
        Position position = current.get();
        if (position.getStatus() != PositionStatus.OPEN) {
            return Optional.empty();
        }

        MarketSnapshot market = fetchMarket(marketId);
        if (market == null) {
            return Optional.empty();
        }
        BigDecimal mark = market.markFor(position.getSide());
        ledger.updateMark(marketId, mark, market.getVolume());

        Optional<ExitDecision> decision = exitPolicy.evaluate(position, mark, market.getVolume());
        if (decision.isEmpty()) {
            return Optional.empty();
        }
        return closePosition(marketId, decision.get());
    }

    private Optional<CompletableFuture<Order>> closePosition(String marketId, ExitDecision decision) {
        Optional<Position> closing = ledger.beginClose(marketId);
        if (closing.isEmpty()) {
            return Optional.empty();
        }
        Position position = closing.get();
        log.info("[EXIT] {} {} x{} entry {}c -> {}c ({}%)", decision.getReason(), marketId,
                position.getQuantity(), position.getAverageEntryPrice(), decision.getPriceCents(),
                decision.getPnlPercent().movePointRight(2));

        OrderRequest request = OrderRequest.builder()
                .clientOrderId("exit-" + marketId + "-" + exitSequence.incrementAndGet())
                .marketId(marketId)
                .side(position.getSide())
                .action(OrderAction.SELL)
                .priceCents(decision.getPriceCents())
                .quantity(position.getQuantity())
                .build();

        CompletableFuture<Order> exit;
        try {
            exit = CompletableFuture.supplyAsync(() -> lifecycleManager.placeAndTrack(request, exitTimeout),
                    exitExecutor);
        } catch (RejectedExecutionException e) {
            ledger.abortClose(marketId);
            log.warn("[EXIT] {} not attempted, monitor is shutting down", marketId);
            return Optional.empty();
        }
        return Optional.of(exit.whenComplete((order, failure) -> {
            if (failure == null) {
                int remaining = position.getQuantity() - order.getFilledQuantity();
                if (remaining > 0) {
                    log.info("[EXIT] {} sold {}/{}, {} left for the next check", marketId,
                            order.getFilledQuantity(), position.getQuantity(), remaining);
                }
                return;
            }
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                    ? failure.getCause() : failure;
            if (cause instanceof LedgerInvariantViolationException) {
                log.error("[EXIT] Ledger invariant violated while closing {}: {}", marketId, cause.getMessage());
                return;
            }
            ledger.abortClose(marketId);
            log.error("[EXIT] Exit for {} failed, position reopened", marketId, cause);
        }));
    }

    private MarketSnapshot fetchMarket(String marketId) {
        CompletableFuture<MarketSnapshot> fetch =
                CompletableFuture.supplyAsync(() -> channel.getMarket(marketId), fetchExecutor);
        try {
            return fetch.get(settings.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            fetch.cancel(true);
            log.warn("[MONITOR] Market fetch for {} timed out after {}ms, skipping this tick", marketId,
                    settings.getFetchTimeout().toMillis());
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransientChannelException || cause instanceof RateGateTimeoutException) {
                log.warn("[MONITOR] Market fetch for {} failed, skipping this tick: {}", marketId, cause.getMessage());
                return null;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Market fetch failed for " + marketId, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    /**
     * Stops scheduling and waits for running checks, then for in-flight exit
     * orders, to finish. The shutdown signal must already be triggered so
     * those orders get cancelled rather than tracked to their timeout.
     */
    public void shutdown() {
        tasks.values().forEach(task -> task.cancel(false));
        tasks.clear();
        scheduler.shutdown();
        try {
            long graceMillis = settings.getShutdownGrace().toMillis();
            if (!scheduler.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                log.error("[MONITOR] Checks still running after {}s grace period",
                        settings.getShutdownGrace().toSeconds());
            }
            exitExecutor.shutdown();
            if (!exitExecutor.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                log.error("[MONITOR] Exit orders still in flight after {}s grace period",
                        settings.getShutdownGrace().toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            fetchExecutor.shutdownNow();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

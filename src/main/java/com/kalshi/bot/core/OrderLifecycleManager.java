package com.kalshi.bot.core;

import com.kalshi.bot.config.TradingProperties;
import com.kalshi.bot.domain.Order;
import com.kalshi.bot.domain.OrderAction;
import com.kalshi.bot.domain.OrderCompletedEvent;
import com.kalshi.bot.domain.OrderRequest;
import com.kalshi.bot.domain.OrderStatus;
import com.kalshi.bot.domain.OrderStatusReport;
import com.kalshi.bot.domain.Position;
import com.kalshi.bot.domain.PositionClosedEvent;
import com.kalshi.bot.domain.PositionStatus;
import com.kalshi.bot.error.ExchangeRejectionException;
import com.kalshi.bot.error.RateGateTimeoutException;
import com.kalshi.bot.error.TransientChannelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Places an order and follows it to a terminal state, then books it into the
 * ledger exactly once.
 *
 * <p>SUBMITTING -> PENDING -> (PARTIALLY_FILLED <-> PENDING) -> FILLED,
 * CANCELED, EXPIRED or REJECTED. On timeout or shutdown the order is cancelled
 * and its fills are re-read once, since the exchange may fill between the
 * cancel request and its confirmation.
 */
@Slf4j
@Service
public class OrderLifecycleManager {

    private final ExchangeChannel channel;
    private final PortfolioLedger ledger;
    private final ShutdownSignal shutdownSignal;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final boolean dryRun;
    private final Duration pollInterval;

    private final Map<String, CompletableFuture<Order>> inFlight = new ConcurrentHashMap<>();

    public OrderLifecycleManager(ExchangeChannel channel, PortfolioLedger ledger, ShutdownSignal shutdownSignal,
            ApplicationEventPublisher eventPublisher, Clock clock, TradingProperties properties) {
        this.channel = channel;
        this.ledger = ledger;
        this.shutdownSignal = shutdownSignal;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.dryRun = properties.isDryRun();
        this.pollInterval = properties.getOrders().getPollInterval();
    }

    /**
     * Submits {@code request} and tracks it until it is terminal. A second call
     * with the same client order id while the first is running waits for and
     * returns the first call's order instead of submitting again.
     */
    public Order placeAndTrack(OrderRequest request, Duration timeout) {
        String key = request.getClientOrderId();
        CompletableFuture<Order> attempt = new CompletableFuture<>();
        CompletableFuture<Order> existing = inFlight.putIfAbsent(key, attempt);
        if (existing != null) {
            log.info("[ORDER] {} already in flight, joining the running attempt", key);
            return existing.join();
        }

        try {
            Order order = execute(request, timeout);
            attempt.complete(order);
            return order;
        } catch (RuntimeException e) {
            attempt.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, attempt);
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private Order execute(OrderRequest request, Duration timeout) {
        Order order = new Order(request, clock.instant());
        log.info("[ORDER] {} {} {} x{} @ {}c ({})", request.getAction(), request.getMarketId(), request.getSide(),
                request.getQuantity(), request.getPriceCents(), request.getClientOrderId());

        if (dryRun) {
            order.assignOrderId("dry-" + request.getClientOrderId());
            order.recordFill(request.getQuantity(), BigDecimal.valueOf(request.getPriceCents()));
            order.finish(OrderStatus.FILLED, clock.instant());
            log.info("[DRY-RUN] {} filled synthetically x{} @ {}c", order.getClientOrderId(),
                    request.getQuantity(), request.getPriceCents());
        } else if (submit(order, request)) {
            try {
                track(order, timeout);
            } catch (RuntimeException e) {
                log.error("[ORDER] {} tracking failed, cancelling and booking confirmed fills",
                        order.getClientOrderId(), e);
                if (!order.isTerminal()) {
                    cancelAndResolve(order, OrderStatus.CANCELED);
                }
            }
        }

        reconcile(order);
        return order;
    }

    private boolean submit(Order order, OrderRequest request) {
        if (shutdownSignal.isTriggered()) {
            order.reject("shutdown in progress", clock.instant());
            return false;
        }
        try {
            order.assignOrderId(channel.submitOrder(request));
            order.transitionTo(OrderStatus.PENDING);
            return true;
        } catch (ExchangeRejectionException e) {
            order.reject("rejected by exchange: " + e.getMessage(), clock.instant());
        } catch (TransientChannelException e) {
            order.reject("submission failed: " + e.getMessage(), clock.instant());
        } catch (RateGateTimeoutException e) {
            order.reject("not attempted: " + e.getMessage(), clock.instant());
        }
        log.warn("[ORDER] {} REJECTED: {}", order.getClientOrderId(), order.getFailureReason());
        return false;
    }

    private void track(Order order, Duration timeout) {
        Instant deadline = order.getCreatedAt().plus(timeout);
        while (true) {
            if (shutdownSignal.await(pollInterval)) {
                log.info("[ORDER] {} shutdown requested, cancelling", order.getClientOrderId());
                cancelAndResolve(order, OrderStatus.CANCELED);
                return;
            }

            OrderStatusReport report = poll(order);
            if (report != null) {
                applyReport(order, report);
                if (order.isFullyFilled()) {
                    order.finish(OrderStatus.FILLED, clock.instant());
                    return;
                }
                if (report.getStatus().isFinal()) {
                    // cancelled, expired or rejected on the exchange side
                    finishWithFills(order, report.getStatus());
                    return;
                }
                OrderStatus working = order.getFilledQuantity() > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.PENDING;
                if (working != order.getStatus()) {
                    order.transitionTo(working);
                }
            }

            if (!clock.instant().isBefore(deadline)) {
                log.info("[ORDER] {} timed out after {}s with {}/{} filled, cancelling", order.getClientOrderId(),
                        timeout.toSeconds(), order.getFilledQuantity(), order.getRequestedQuantity());
                cancelAndResolve(order, OrderStatus.EXPIRED);
                return;
            }
        }
    }

    private OrderStatusReport poll(Order order) {
        try {
            return channel.getOrder(order.getOrderId());
        } catch (TransientChannelException | RateGateTimeoutException e) {
            log.warn("[ORDER] {} status poll failed, retrying next interval: {}", order.getClientOrderId(),
                    e.getMessage());
            return null;
        } catch (ExchangeRejectionException e) {
            // e.g. 404 while the new order propagates; it stays live until cancelled
            log.warn("[ORDER] {} status poll refused, retrying next interval: {}", order.getClientOrderId(),
                    e.getMessage());
            return null;
        }
    }

    private static void applyReport(Order order, OrderStatusReport report) {
        order.syncFills(report.getFilledQuantity(), report.getAverageFillPrice());
        if (report.getStatus() == OrderStatus.FILLED && !order.isFullyFilled()) {
            // executed without a fill count: the exchange confirms the full quantity
            order.syncFills(order.getRequestedQuantity(), report.getAverageFillPrice());
        }
    }

    private void cancelAndResolve(Order order, OrderStatus statusIfUnfilled) {
        try {
            channel.cancelOrder(order.getOrderId());
        } catch (ExchangeRejectionException e) {
            log.info("[ORDER] {} cancel refused, order likely already done: {}", order.getClientOrderId(),
                    e.getMessage());
        } catch (TransientChannelException | RateGateTimeoutException e) {
            log.error("[ORDER] {} cancel request failed: {}", order.getClientOrderId(), e.getMessage());
        }

        try {
            applyReport(order, channel.getOrder(order.getOrderId()));
        } catch (RuntimeException e) {
            log.error("[ORDER] {} post-cancel fill check failed, resolving from last known fills ({}): {}",
                    order.getClientOrderId(), order.getFilledQuantity(), e.getMessage());
        }

        if (order.isFullyFilled()) {
            order.finish(OrderStatus.FILLED, clock.instant());
        } else {
            finishWithFills(order, statusIfUnfilled);
        }
    }

    private void finishWithFills(Order order, OrderStatus statusIfUnfilled) {
        if (order.getFilledQuantity() > 0) {
            order.finish(OrderStatus.PARTIALLY_FILLED, clock.instant());
        } else {
            order.finish(statusIfUnfilled, clock.instant());
        }
    }

    private void reconcile(Order order) {
        if (!order.markReconciled()) {
            return;
        }
        log.info("[ORDER] {} terminal: {} {}/{} @ {}c", order.getClientOrderId(), order.getStatus(),
                order.getFilledQuantity(), order.getRequestedQuantity(), order.getAverageFillPrice());

        if (order.getAction() == OrderAction.BUY) {
            ledger.applyFill(order);
            eventPublisher.publishEvent(new OrderCompletedEvent(order));
        } else {
            Optional<Position> position = ledger.applyClose(order);
            eventPublisher.publishEvent(new OrderCompletedEvent(order));
            position.filter(p -> p.getStatus() == PositionStatus.CLOSED)
                    .ifPresent(p -> eventPublisher.publishEvent(new PositionClosedEvent(p)));
        }
    }
}

package com.kalshi.bot.core;

import com.kalshi.bot.domain.ExchangePosition;
import com.kalshi.bot.domain.MarketPage;
import com.kalshi.bot.domain.MarketSnapshot;
import com.kalshi.bot.domain.OrderRequest;
import com.kalshi.bot.domain.OrderStatusReport;
import com.kalshi.bot.error.TransientChannelException;
import com.kalshi.bot.infra.ExchangeTransport;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * The single path to the exchange. Every attempt takes a {@link RateGate}
 * permit; transient failures are retried with exponential backoff, anything
 * else propagates unchanged.
 */
@Slf4j
public class ExchangeChannel {

    private final ExchangeTransport transport;
    private final RateGate rateGate;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final ShutdownSignal shutdownSignal;

    public ExchangeChannel(ExchangeTransport transport, RateGate rateGate, int maxRetries, Duration retryBackoff,
            ShutdownSignal shutdownSignal) {
        this.transport = transport;
        this.rateGate = rateGate;
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;
        this.shutdownSignal = shutdownSignal;
    }

    public BigDecimal getBalance() {
        return call("getBalance", transport::getBalance);
    }

    public MarketPage listMarkets(String cursor, int limit) {
        return call("listMarkets", () -> transport.listMarkets(cursor, limit));
    }

    public List<ExchangePosition> getPositions() {
        return call("getPositions", transport::getPositions);
    }

    public MarketSnapshot getMarket(String marketId) {
        return call("getMarket " + marketId, () -> transport.getMarket(marketId));
    }

    public String submitOrder(OrderRequest request) {
        return call("submitOrder " + request.getClientOrderId(), () -> transport.submitOrder(request));
    }

    public OrderStatusReport getOrder(String orderId) {
        return call("getOrder " + orderId, () -> transport.getOrder(orderId));
    }

    public void cancelOrder(String orderId) {
        call("cancelOrder " + orderId, () -> {
            transport.cancelOrder(orderId);
            return null;
        });
    }

    private <T> T call(String operation, Supplier<T> action) {
        int attempt = 0;
        while (true) {
            rateGate.acquire();
            try {
                return action.get();
            } catch (TransientChannelException e) {
                if (attempt >= maxRetries) {
                    log.error("[CHANNEL] {} failed after {} retries: {}", operation, maxRetries, e.getMessage());
                    throw e;
                }
                long delayMillis = retryBackoff.toMillis() << attempt;
                attempt++;
                log.warn("[CHANNEL] {} failed ({}), retry {}/{} in {}ms",
                        operation, e.getMessage(), attempt, maxRetries, delayMillis);
                if (shutdownSignal.await(Duration.ofMillis(delayMillis))) {
                    log.info("[CHANNEL] {} abandoned, shutdown in progress", operation);
                    throw e;
                }
            }
        }
    }
}

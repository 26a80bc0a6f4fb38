package com.kalshi.bot.infra;

import com.kalshi.bot.domain.ExchangePosition;
import com.kalshi.bot.domain.MarketPage;
import com.kalshi.bot.domain.MarketSnapshot;
import com.kalshi.bot.domain.OrderRequest;
import com.kalshi.bot.domain.OrderStatusReport;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw calls to the exchange. Implementations do not throttle or retry; callers
 * go through {@link com.kalshi.bot.core.ExchangeChannel}.
 *
 * <p>Every method may throw {@link com.kalshi.bot.error.TransientChannelException}
 * for network/auth/throttling failures and
 * {@link com.kalshi.bot.error.ExchangeRejectionException} for business
 * rejections.
 */
public interface ExchangeTransport {

    /** Available cash in cents. */
    BigDecimal getBalance();

    MarketPage listMarkets(String cursor, int limit);

    /** Contracts currently held, one entry per market. Settled markets are left out. */
    List<ExchangePosition> getPositions();

    MarketSnapshot getMarket(String marketId);

    /** @return the exchange-assigned order id */
    String submitOrder(OrderRequest request);

    OrderStatusReport getOrder(String orderId);

    void cancelOrder(String orderId);
}

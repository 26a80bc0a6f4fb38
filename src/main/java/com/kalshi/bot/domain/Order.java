package com.kalshi.bot.domain;

import com.kalshi.bot.error.IllegalOrderTransitionException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single order tracked from submission to its terminal state.
 *
 * <p>Owned by the thread running its lifecycle; other threads only see it once
 * it is terminal. Fill accounting keeps the exact fill cost so the average
 * price is always the quantity-weighted mean of the constituent fills.
 */
@Getter
@ToString
public class Order {

    private final String clientOrderId;
    private final String marketId;
    private final Side side;
    private final OrderAction action;
    private final int requestedPriceCents;
    private final int requestedQuantity;
    private final Instant createdAt;

    private String orderId;
    private OrderStatus status = OrderStatus.SUBMITTING;
    private int filledQuantity;
    private BigDecimal fillCost = BigDecimal.ZERO; // cents
    private Instant terminalAt;
    private String failureReason;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private final AtomicBoolean reconciled = new AtomicBoolean();

    public Order(OrderRequest request, Instant createdAt) {
        this.clientOrderId = request.getClientOrderId();
        this.marketId = request.getMarketId();
        this.side = request.getSide();
        this.action = request.getAction();
        this.requestedPriceCents = request.getPriceCents();
        this.requestedQuantity = request.getQuantity();
        this.createdAt = createdAt;
    }

    public void assignOrderId(String orderId) {
        this.orderId = orderId;
    }

    public void transitionTo(OrderStatus next) {
        if (isTerminal() || !status.canTransitionTo(next)) {
            throw new IllegalOrderTransitionException(clientOrderId, status, next);
        }
        this.status = next;
    }

    /** Adds one fill of {@code quantity} contracts at {@code priceCents}. */
    public void recordFill(int quantity, BigDecimal priceCents) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive");
        }
        if (filledQuantity + quantity > requestedQuantity) {
            throw new IllegalOrderTransitionException("Order " + clientOrderId + " overfilled: "
                    + (filledQuantity + quantity) + " > " + requestedQuantity);
        }
        filledQuantity += quantity;
        fillCost = fillCost.add(priceCents.multiply(BigDecimal.valueOf(quantity)));
    }

    /**
     * Applies the exchange's cumulative fill report. Stale reports (fewer fills
     * than already seen) are ignored; fills beyond the requested quantity are
     * refused.
     */
    public void syncFills(int cumulativeQuantity, BigDecimal averagePriceCents) {
        if (cumulativeQuantity > requestedQuantity) {
            throw new IllegalOrderTransitionException("Order " + clientOrderId + " reported "
                    + cumulativeQuantity + " filled of " + requestedQuantity);
        }
        if (cumulativeQuantity <= filledQuantity) {
            return;
        }
        BigDecimal average = averagePriceCents != null && averagePriceCents.signum() > 0
                ? averagePriceCents
                : BigDecimal.valueOf(requestedPriceCents);
        filledQuantity = cumulativeQuantity;
        fillCost = average.multiply(BigDecimal.valueOf(cumulativeQuantity));
    }

    /** Moves to {@code finalStatus} (if not already there) and stamps the terminal time. */
    public void finish(OrderStatus finalStatus, Instant at) {
        if (status != finalStatus) {
            transitionTo(finalStatus);
        } else if (isTerminal()) {
            throw new IllegalOrderTransitionException(clientOrderId, status, finalStatus);
        }
        this.terminalAt = at;
    }

    public void reject(String reason, Instant at) {
        this.failureReason = reason;
        finish(OrderStatus.REJECTED, at);
    }

    public boolean isTerminal() {
        return terminalAt != null;
    }

    public boolean isFullyFilled() {
        return filledQuantity == requestedQuantity;
    }

    public BigDecimal getAverageFillPrice() {
        if (filledQuantity == 0) {
            return BigDecimal.ZERO;
        }
        return fillCost.divide(BigDecimal.valueOf(filledQuantity), 4, RoundingMode.HALF_EVEN);
    }

    /**
     * Claims the one-time ledger reconciliation of this order.
     *
     * @return true for the first caller only
     */
    public boolean markReconciled() {
        return reconciled.compareAndSet(false, true);
    }
}

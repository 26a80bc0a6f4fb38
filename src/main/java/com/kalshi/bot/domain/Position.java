package com.kalshi.bot.domain;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Contracts held in one market. Instances inside the ledger are mutated only
 * under the ledger lock; everything handed out is a {@link #copy()}.
 */
@Getter
@ToString
public class Position {

    private final String marketId;
    private final Side side;
    private final Instant enteredAt;
    private int quantity;
    private BigDecimal costBasis = BigDecimal.ZERO; // cents paid for the contracts still held
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private PositionStatus status = PositionStatus.OPEN;
    private BigDecimal lastMark;
    private long lastVolume;
    private Instant closedAt;

    public Position(String marketId, Side side, Instant enteredAt) {
        this.marketId = marketId;
        this.side = side;
        this.enteredAt = enteredAt;
    }

    private Position(Position other) {
        this.marketId = other.marketId;
        this.side = other.side;
        this.enteredAt = other.enteredAt;
        this.quantity = other.quantity;
        this.costBasis = other.costBasis;
        this.realizedPnl = other.realizedPnl;
        this.status = other.status;
        this.lastMark = other.lastMark;
        this.lastVolume = other.lastVolume;
        this.closedAt = other.closedAt;
    }

    public Position copy() {
        return new Position(this);
    }

    public BigDecimal getAverageEntryPrice() {
        if (quantity == 0) {
            return BigDecimal.ZERO;
        }
        return costBasis.divide(BigDecimal.valueOf(quantity), 4, RoundingMode.HALF_EVEN);
    }

    public BigDecimal getUnrealizedPnl() {
        if (lastMark == null || quantity == 0) {
            return BigDecimal.ZERO;
        }
        return lastMark.multiply(BigDecimal.valueOf(quantity)).subtract(costBasis);
    }

    public void addContracts(int contracts, BigDecimal cost) {
        quantity += contracts;
        costBasis = costBasis.add(cost);
    }

    /**
     * Removes {@code contracts} sold for {@code proceeds} and returns the P&L
     * realized by the sale, net of {@code fees}.
     */
    public BigDecimal removeContracts(int contracts, BigDecimal proceeds, BigDecimal fees) {
        BigDecimal released = contracts == quantity
                ? costBasis
                : costBasis.multiply(BigDecimal.valueOf(contracts))
                        .divide(BigDecimal.valueOf(quantity), 6, RoundingMode.HALF_EVEN);
        quantity -= contracts;
        costBasis = costBasis.subtract(released);
        BigDecimal pnl = proceeds.subtract(released).subtract(fees);
        realizedPnl = realizedPnl.add(pnl);
        return pnl;
    }

    public void updateMark(BigDecimal mark, long volume) {
        this.lastMark = mark;
        this.lastVolume = volume;
    }

    public void setStatus(PositionStatus status) {
        this.status = status;
    }

    public void markClosed(Instant at) {
        this.status = PositionStatus.CLOSED;
        this.closedAt = at;
    }
}

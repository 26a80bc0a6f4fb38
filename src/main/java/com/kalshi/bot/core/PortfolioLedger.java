package com.kalshi.bot.core;

import com.kalshi.bot.domain.ExchangePosition;
import com.kalshi.bot.domain.Order;
import com.kalshi.bot.domain.OrderAction;
import com.kalshi.bot.domain.PerformanceReport;
import com.kalshi.bot.domain.PortfolioSnapshot;
import com.kalshi.bot.domain.Position;
import com.kalshi.bot.domain.PositionStatus;
import com.kalshi.bot.error.LedgerInvariantViolationException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Authoritative record of cash and positions. Amounts are in cents.
 *
 * <p>Every read and write runs under one lock; no exchange call is ever made
 * while holding it. After each mutation the ledger checks
 * {@code cash + costBasis - realizedPnl + entryFees == startingCash}; any
 * broken invariant halts the ledger, after which it refuses new entries.
 */
@Slf4j
public class PortfolioLedger {

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final BigDecimal startingCash;
    private final BigDecimal feePerContract;

    private BigDecimal cash;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal entryFees = BigDecimal.ZERO;
    private BigDecimal feesPaid = BigDecimal.ZERO;

    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<Position> closedPositions = new ArrayList<>();
    private final Set<String> pendingEntries = new HashSet<>();
    private final Set<String> appliedOrders = new HashSet<>();

    private volatile String haltReason;

    public PortfolioLedger(BigDecimal startingCash, BigDecimal feePerContract, Clock clock) {
        this(startingCash, List.of(), feePerContract, clock);
    }

    /**
     * Starts from {@code cash} plus positions already held on the exchange.
     * Held cost counts toward the starting value, so conservation holds from
     * the first fill.
     */
    public PortfolioLedger(BigDecimal cash, List<ExchangePosition> held, BigDecimal feePerContract, Clock clock) {
        if (cash.signum() < 0) {
            throw new IllegalArgumentException("Starting cash cannot be negative");
        }
        this.clock = clock;
        this.feePerContract = feePerContract;
        this.cash = cash;
        BigDecimal heldCost = BigDecimal.ZERO;
        for (ExchangePosition holding : held) {
            if (holding.getQuantity() <= 0 || holding.getCostCents().signum() < 0) {
                throw new IllegalArgumentException("Invalid held position " + holding);
            }
            if (positions.containsKey(holding.getMarketId())) {
                throw new IllegalArgumentException("Duplicate held position on " + holding.getMarketId());
            }
            Position position = new Position(holding.getMarketId(), holding.getSide(), clock.instant());
            position.addContracts(holding.getQuantity(), holding.getCostCents());
            positions.put(holding.getMarketId(), position);
            heldCost = heldCost.add(holding.getCostCents());
        }
        this.startingCash = cash.add(heldCost);
    }

    /**
     * Reserves {@code marketId} for one entry order. Refused while the market
     * holds a position or another entry, when open positions plus in-flight
     * entries reach {@code maxConcurrent}, or once the ledger has halted.
     */
    public EntryClaim tryClaimEntry(String marketId, int maxConcurrent) {
        return locked(() -> {
            if (isHalted()) {
                return EntryClaim.HALTED;
            }
            if (positions.containsKey(marketId) || pendingEntries.contains(marketId)) {
                return EntryClaim.MARKET_BUSY;
            }
            if (positions.size() + pendingEntries.size() >= maxConcurrent) {
                return EntryClaim.CAP_REACHED;
            }
            pendingEntries.add(marketId);
            return EntryClaim.CLAIMED;
        });
    }

    public void releaseEntry(String marketId) {
        locked(() -> pendingEntries.remove(marketId));
    }

    public int pendingEntryCount() {
        return locked(pendingEntries::size);
    }

    /**
     * Books a terminal BUY order: debits cash and creates or grows the
     * position. Releases the market's entry claim whatever was filled.
     *
     * @return false if this order was already applied
     */
    public boolean applyFill(Order order) {
        requireTerminal(order, OrderAction.BUY);
        return locked(() -> {
            if (!appliedOrders.add(order.getClientOrderId())) {
                return false;
            }
            pendingEntries.remove(order.getMarketId());
            int filled = order.getFilledQuantity();
            if (filled == 0) {
                return true;
            }

            BigDecimal cost = order.getFillCost();
            BigDecimal fee = feePerContract.multiply(BigDecimal.valueOf(filled));
            BigDecimal remaining = cash.subtract(cost).subtract(fee);
            if (remaining.signum() < 0) {
                throw violation("Fill " + order.getClientOrderId() + " costing " + cost.add(fee)
                        + "c exceeds cash " + cash + "c");
            }

            Position position = positions.get(order.getMarketId());
            if (position == null) {
                position = new Position(order.getMarketId(), order.getSide(), clock.instant());
                positions.put(order.getMarketId(), position);
            } else if (position.getSide() != order.getSide() || position.getStatus() != PositionStatus.OPEN) {
                throw violation("Entry fill " + order.getClientOrderId() + " on " + order.getMarketId()
                        + " conflicts with existing " + position.getStatus() + " " + position.getSide() + " position");
            }

            position.addContracts(filled, cost);
            cash = remaining;
            entryFees = entryFees.add(fee);
            feesPaid = feesPaid.add(fee);
            verifyConservation();

            log.info("[LEDGER] BUY {} {} x{} @ {}c | cash {}c", order.getMarketId(), order.getSide(), filled,
                    order.getAverageFillPrice(), cash);
            return true;
        });
    }

    /**
     * Moves an OPEN position to CLOSING so exactly one exit can be in flight.
     *
     * @return copy of the position now CLOSING, or empty if it was not OPEN
     */
    public Optional<Position> beginClose(String marketId) {
        return locked(() -> {
            Position position = positions.get(marketId);
            if (position == null || position.getStatus() != PositionStatus.OPEN || isHalted()) {
                return Optional.empty();
            }
            position.setStatus(PositionStatus.CLOSING);
            return Optional.of(position.copy());
        });
    }

    /** Returns a CLOSING position to OPEN when its exit could not be attempted. */
    public void abortClose(String marketId) {
        locked(() -> {
            Position position = positions.get(marketId);
            if (position != null && position.getStatus() == PositionStatus.CLOSING) {
                position.setStatus(PositionStatus.OPEN);
            }
            return null;
        });
    }

    /**
     * Books a terminal SELL order against the CLOSING position: credits the
     * proceeds, realizes P&L and archives the position once nothing is left.
     * Any residual quantity goes back to OPEN.
     *
     * @return copy of the position after the update, empty if already applied
     */
    public Optional<Position> applyClose(Order order) {
        requireTerminal(order, OrderAction.SELL);
        return locked(() -> {
            if (!appliedOrders.add(order.getClientOrderId())) {
                return Optional.empty();
            }
            Position position = positions.get(order.getMarketId());
            if (position == null || position.getStatus() != PositionStatus.CLOSING) {
                throw violation("Exit " + order.getClientOrderId() + " has no CLOSING position on "
                        + order.getMarketId());
            }

            int filled = order.getFilledQuantity();
            if (filled > position.getQuantity()) {
                throw violation("Exit " + order.getClientOrderId() + " sold " + filled + " of "
                        + position.getQuantity() + " held");
            }
            if (filled == 0) {
                position.setStatus(PositionStatus.OPEN);
                return Optional.of(position.copy());
            }

            BigDecimal proceeds = order.getFillCost();
            BigDecimal fee = feePerContract.multiply(BigDecimal.valueOf(filled));
            BigDecimal pnl = position.removeContracts(filled, proceeds, fee);
            cash = cash.add(proceeds).subtract(fee);
            realizedPnl = realizedPnl.add(pnl);
            feesPaid = feesPaid.add(fee);

            if (position.getQuantity() == 0) {
                position.markClosed(clock.instant());
                positions.remove(position.getMarketId());
                closedPositions.add(position);
            } else {
                position.setStatus(PositionStatus.OPEN);
            }
            verifyConservation();

            log.info("[LEDGER] SELL {} x{} @ {}c | P&L {}c | remaining {} | cash {}c", order.getMarketId(), filled,
                    order.getAverageFillPrice(), pnl, position.getQuantity(), cash);
            return Optional.of(position.copy());
        });
    }

    public void updateMark(String marketId, BigDecimal mark, long volume) {
        locked(() -> {
            Position position = positions.get(marketId);
            if (position != null && mark != null) {
                position.updateMark(mark, volume);
            }
            return null;
        });
    }

    public PortfolioSnapshot snapshot() {
        return locked(() -> {
            BigDecimal costBasis = BigDecimal.ZERO;
            BigDecimal unrealized = BigDecimal.ZERO;
            for (Position position : positions.values()) {
                costBasis = costBasis.add(position.getCostBasis());
                unrealized = unrealized.add(position.getUnrealizedPnl());
            }
            return PortfolioSnapshot.builder()
                    .cash(cash)
                    .costBasis(costBasis)
                    .unrealizedPnl(unrealized)
                    .realizedPnl(realizedPnl)
                    .feesPaid(feesPaid)
                    .baselineValue(startingCash)
                    .openPositions(positions.size())
                    .takenAt(clock.instant())
                    .build();
        });
    }

    public Optional<Position> position(String marketId) {
        return locked(() -> Optional.ofNullable(positions.get(marketId)).map(Position::copy));
    }

    public List<Position> openPositions() {
        return locked(() -> positions.values().stream().map(Position::copy).toList());
    }

    public List<Position> closedPositions() {
        return locked(() -> closedPositions.stream().map(Position::copy).toList());
    }

    public PerformanceReport performance() {
        PortfolioSnapshot snapshot = snapshot();
        return locked(() -> PerformanceReport.builder()
                .startingValue(startingCash)
                .currentValue(snapshot.totalValue())
                .realizedPnl(realizedPnl)
                .closedTrades(closedPositions.size())
                .winningTrades((int) closedPositions.stream().filter(p -> p.getRealizedPnl().signum() > 0).count())
                .build());
    }

    public boolean isHalted() {
        return haltReason != null;
    }

    public String getHaltReason() {
        return haltReason;
    }

    private void verifyConservation() {
        BigDecimal costBasis = positions.values().stream()
                .map(Position::getCostBasis)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal accounted = cash.add(costBasis).subtract(realizedPnl).add(entryFees);
        if (accounted.compareTo(startingCash) != 0) {
            throw violation("Conservation broken: cash " + cash + " + cost " + costBasis + " - realized "
                    + realizedPnl + " + entry fees " + entryFees + " = " + accounted + " != " + startingCash);
        }
        if (cash.signum() < 0) {
            throw violation("Cash went negative: " + cash);
        }
    }

    private LedgerInvariantViolationException violation(String message) {
        if (haltReason == null) {
            haltReason = message;
        }
        log.error("[LEDGER] INVARIANT VIOLATED, halting new orders: {}", message);
        return new LedgerInvariantViolationException(message);
    }

    private static void requireTerminal(Order order, OrderAction expected) {
        if (order.getAction() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " order, got " + order.getAction());
        }
        if (!order.isTerminal()) {
            throw new IllegalArgumentException("Order " + order.getClientOrderId() + " is not terminal");
        }
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}

package com.kalshi.bot.core;

import com.kalshi.bot.domain.ExchangePosition;
import com.kalshi.bot.domain.PerformanceReport;
import com.kalshi.bot.domain.PortfolioSnapshot;
import com.kalshi.bot.domain.Position;
import com.kalshi.bot.domain.PositionStatus;
import com.kalshi.bot.domain.Side;
import com.kalshi.bot.error.LedgerInvariantViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioLedgerTest {

    private final Clock clock = Clock.fixed(OrderFixtures.NOW, ZoneOffset.UTC);
    private PortfolioLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new PortfolioLedger(new BigDecimal("100000"), BigDecimal.ZERO, clock);
    }

    private static void assertCents(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    void testEntryFillDebitsCashAndOpensPosition() {
        assertEquals(EntryClaim.CLAIMED, ledger.tryClaimEntry("MKT-A", 10));
        assertTrue(ledger.applyFill(OrderFixtures.buy("entry-1", "MKT-A", 142, 70, 142)));

        PortfolioSnapshot snapshot = ledger.snapshot();
        assertCents("90060", snapshot.getCash());
        assertCents("9940", snapshot.getCostBasis());
        assertCents("100000", snapshot.totalValue());
        assertEquals(1, snapshot.getOpenPositions());
        assertEquals(0, ledger.pendingEntryCount());

        Position position = ledger.position("MKT-A").orElseThrow();
        assertEquals(142, position.getQuantity());
        assertCents("70", position.getAverageEntryPrice());
    }

    @Test
    void testClaimsAllowOneEntryPerMarket() {
        assertEquals(EntryClaim.CLAIMED, ledger.tryClaimEntry("MKT-A", 2));
        assertEquals(EntryClaim.MARKET_BUSY, ledger.tryClaimEntry("MKT-A", 2));
        assertEquals(EntryClaim.CLAIMED, ledger.tryClaimEntry("MKT-B", 2));
        assertEquals(EntryClaim.CAP_REACHED, ledger.tryClaimEntry("MKT-C", 2));

        ledger.releaseEntry("MKT-B");
        assertEquals(EntryClaim.CLAIMED, ledger.tryClaimEntry("MKT-C", 2));

        ledger.applyFill(OrderFixtures.buy("entry-a", "MKT-A", 10, 50, 10));
        assertEquals(EntryClaim.MARKET_BUSY, ledger.tryClaimEntry("MKT-A", 5));
    }

    @Test
    void testUnfilledEntryReleasesClaimWithoutPosition() {
        ledger.tryClaimEntry("MKT-A", 10);
        ledger.applyFill(OrderFixtures.buy("entry-1", "MKT-A", 10, 70, 0));

        assertEquals(0, ledger.pendingEntryCount());
        assertTrue(ledger.position("MKT-A").isEmpty());
        assertCents("100000", ledger.snapshot().getCash());
    }

    @Test
    void testSameOrderIsAppliedOnce() {
        var order = OrderFixtures.buy("entry-1", "MKT-A", 10, 70, 10);
        assertTrue(ledger.applyFill(order));
        assertFalse(ledger.applyFill(order));

        assertCents("99300", ledger.snapshot().getCash());
        assertEquals(10, ledger.position("MKT-A").orElseThrow().getQuantity());
    }

    @Test
    void testFullCloseRealizesProfitAndArchives() {
        ledger.applyFill(OrderFixtures.buy("entry-1", "MKT-A", 100, 80, 100));
        assertTrue(ledger.beginClose("MKT-A").isPresent());

        Optional<Position> closed = ledger.applyClose(OrderFixtures.sell("exit-1", "MKT-A", 100, 86, 100));

        assertEquals(PositionStatus.CLOSED, closed.orElseThrow().getStatus());
        assertTrue(ledger.position("MKT-A").isEmpty());
        assertEquals(1, ledger.closedPositions().size());

        PortfolioSnapshot snapshot = ledger.snapshot();
        assertCents("100600", snapshot.getCash());
        assertCents("600", snapshot.getRealizedPnl());
        assertCents("0", snapshot.getCostBasis());

        PerformanceReport report = ledger.performance();
        assertEquals(1, report.getClosedTrades());
        assertEquals(1, report.getWinningTrades());
        assertCents("1.006", report.compoundMultiplier());
    }

    @Test
    void testPartialCloseLeavesResidualOpen() {
        ledger.applyFill(OrderFixtures.buy("entry-1", "MKT-A", 100, 80, 100));
        ledger.beginClose("MKT-A");

        Position after = ledger.applyClose(OrderFixtures.sell("exit-1", "MKT-A", 100, 90, 40)).orElseThrow();

        assertEquals(PositionStatus.OPEN, after.getStatus());
        assertEquals(60, after.getQuantity());
        assertCents("4800", after.getCostBasis());

        PortfolioSnapshot snapshot = ledger.snapshot();
        assertCents("95600", snapshot.getCash());
        assertCents("400", snapshot.getRealizedPnl());
        // cash + cost basis - realized stays equal to the starting cash
        assertCents("100000", snapshot.getCash().add(snapshot.getCostBasis()).subtract(snapshot.getRealizedPnl()));
    }

    @Test
    void testZeroFillCloseRevertsToOpen() {
        ledger.applyFill(OrderFixtures.buy("entry-1", "MKT-A", 10, 80, 10));
        ledger.beginClose("MKT-A");

        Position after = ledger.applyClose(OrderFixtures.sell("exit-1", "MKT-A", 10, 90, 0)).orElseThrow();

        assertEquals(PositionStatus.OPEN, after.getStatus());
        assertEquals(10, after.getQuantity());
    }

    @Test
    void testOnlyOneCloseAtATime() {
        ledger.applyFill(OrderFixtures.buy("entry-1", "MKT-A", 10, 80, 10));

        assertTrue(ledger.beginClose("MKT-A").isPresent());
        assertTrue(ledger.beginClose("MKT-A").isEmpty());

        ledger.abortClose("MKT-A");
        assertEquals(PositionStatus.OPEN, ledger.position("MKT-A").orElseThrow().getStatus());
        assertTrue(ledger.beginClose("MKT-A").isPresent());
    }

    @Test
    void testFeesAreChargedOnBothLegs() {
        PortfolioLedger withFees = new PortfolioLedger(new BigDecimal("100000"), BigDecimal.ONE, clock);
        withFees.applyFill(OrderFixtures.buy("entry-1", "MKT-A", 100, 80, 100));
        assertCents("91900", withFees.snapshot().getCash());

        withFees.beginClose("MKT-A");
        withFees.applyClose(OrderFixtures.sell("exit-1", "MKT-A", 100, 86, 100));

        PortfolioSnapshot snapshot = withFees.snapshot();
        assertCents("100400", snapshot.getCash());
        assertCents("500", snapshot.getRealizedPnl());
        assertCents("200", snapshot.getFeesPaid());
    }

    @Test
    void testFillBeyondCashHaltsLedger() {
        PortfolioLedger small = new PortfolioLedger(new BigDecimal("1000"), BigDecimal.ZERO, clock);

        assertThrows(LedgerInvariantViolationException.class,
                () -> small.applyFill(OrderFixtures.buy("entry-1", "MKT-A", 20, 70, 20)));

        assertTrue(small.isHalted());
        assertNotNull(small.getHaltReason());
        assertEquals(EntryClaim.HALTED, small.tryClaimEntry("MKT-B", 10));
    }

    @Test
    void testExitWithoutClosingPositionIsViolation() {
        ledger.applyFill(OrderFixtures.buy("entry-1", "MKT-A", 10, 80, 10));

        assertThrows(LedgerInvariantViolationException.class,
                () -> ledger.applyClose(OrderFixtures.sell("exit-1", "MKT-A", 10, 90, 10)));
        assertTrue(ledger.isHalted());
        assertTrue(ledger.beginClose("MKT-A").isEmpty());
    }

    @Test
    void testMarkFeedsUnrealizedPnl() {
        ledger.applyFill(OrderFixtures.buy("entry-1", "MKT-A", 100, 80, 100));
        ledger.updateMark("MKT-A", new BigDecimal("85"), 5000);

        PortfolioSnapshot snapshot = ledger.snapshot();
        assertCents("500", snapshot.getUnrealizedPnl());
        assertCents("100500", snapshot.totalValue());
        assertEquals(5000, ledger.position("MKT-A").orElseThrow().getLastVolume());
    }

    @Test
    void testCallersOnlySeeCopies() {
        ledger.applyFill(OrderFixtures.buy("entry-1", "MKT-A", 10, 80, 10));
        Position copy = ledger.position("MKT-A").orElseThrow();
        copy.setStatus(PositionStatus.CLOSING);

        assertEquals(PositionStatus.OPEN, ledger.position("MKT-A").orElseThrow().getStatus());
    }

    @Test
    void testHeldPositionsSeedTheLedger() {
        PortfolioLedger seeded = new PortfolioLedger(new BigDecimal("5000"), List.of(ExchangePosition.builder()
                .marketId("MKT-A")
                .side(Side.YES)
                .quantity(12)
                .costCents(new BigDecimal("1020"))
                .build()), BigDecimal.ZERO, clock);

        PortfolioSnapshot start = seeded.snapshot();
        assertCents("5000", start.getCash());
        assertCents("1020", start.getCostBasis());
        assertCents("6020", start.getBaselineValue());
        assertCents("6020", start.totalValue());
        assertEquals(EntryClaim.MARKET_BUSY, seeded.tryClaimEntry("MKT-A", 10));
        assertEquals(EntryClaim.CAP_REACHED, seeded.tryClaimEntry("MKT-B", 1));

        assertTrue(seeded.beginClose("MKT-A").isPresent());
        seeded.applyClose(OrderFixtures.sell("exit-1", "MKT-A", 12, 90, 12));

        assertFalse(seeded.isHalted());
        PortfolioSnapshot end = seeded.snapshot();
        assertCents("6080", end.getCash());
        assertCents("60", end.getRealizedPnl());
        assertCents("6020", seeded.performance().getStartingValue());
    }

    @Test
    void testDuplicateHeldMarketIsRefused() {
        ExchangePosition held = ExchangePosition.builder()
                .marketId("MKT-A").side(Side.NO).quantity(3).costCents(new BigDecimal("90")).build();

        assertThrows(IllegalArgumentException.class,
                () -> new PortfolioLedger(BigDecimal.ZERO, List.of(held, held), BigDecimal.ZERO, clock));
    }

    @Test
    void testConcurrentEntriesAndExitsKeepOneOwnerPerMarket() throws Exception {
        int markets = 5;
        int threads = 8;
        AtomicInteger[] owners = new AtomicInteger[markets];
        for (int i = 0; i < markets; i++) {
            owners[i] = new AtomicInteger();
        }
        AtomicInteger overlaps = new AtomicInteger();
        AtomicLong ids = new AtomicLong();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<?>> workers = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            workers.add(pool.submit(() -> {
                start.await();
                ThreadLocalRandom random = ThreadLocalRandom.current();
                for (int i = 0; i < 2000; i++) {
                    int m = random.nextInt(markets);
                    String market = "MKT-" + m;
                    if (random.nextBoolean()) {
                        if (ledger.tryClaimEntry(market, markets) != EntryClaim.CLAIMED) {
                            continue;
                        }
                        if (owners[m].incrementAndGet() != 1) {
                            overlaps.incrementAndGet();
                        }
                        int filled = random.nextInt(4) == 0 ? 0 : 10;
                        owners[m].decrementAndGet();
                        ledger.applyFill(OrderFixtures.buy("entry-" + ids.incrementAndGet(), market, 10,
                                40 + random.nextInt(21), filled));
                    } else {
                        Optional<Position> closing = ledger.beginClose(market);
                        if (closing.isEmpty()) {
                            continue;
                        }
                        if (owners[m].incrementAndGet() != 1) {
                            overlaps.incrementAndGet();
                        }
                        int held = closing.get().getQuantity();
                        int filled = random.nextInt(held + 1);
                        owners[m].decrementAndGet();
                        ledger.applyClose(OrderFixtures.sell("exit-" + ids.incrementAndGet(), market, held,
                                40 + random.nextInt(21), filled));
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> worker : workers) {
            worker.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(0, overlaps.get());
        assertFalse(ledger.isHalted(), () -> ledger.getHaltReason());
        assertEquals(0, ledger.pendingEntryCount());

        Set<String> seen = new HashSet<>();
        for (Position position : ledger.openPositions()) {
            assertTrue(seen.add(position.getMarketId()));
            assertEquals(PositionStatus.OPEN, position.getStatus());
            assertTrue(position.getQuantity() > 0);
        }
        PortfolioSnapshot snapshot = ledger.snapshot();
        assertTrue(snapshot.getCash().signum() >= 0);
        assertCents("100000", snapshot.getCash().add(snapshot.getCostBasis()).subtract(snapshot.getRealizedPnl()));
    }
}

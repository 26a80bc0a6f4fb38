package com.kalshi.bot.core;

import com.kalshi.bot.config.TradingProperties;
import com.kalshi.bot.domain.Order;
import com.kalshi.bot.domain.OrderAction;
import com.kalshi.bot.domain.OrderCompletedEvent;
import com.kalshi.bot.domain.OrderRequest;
import com.kalshi.bot.domain.OrderStatus;
import com.kalshi.bot.domain.OrderStatusReport;
import com.kalshi.bot.domain.PositionClosedEvent;
import com.kalshi.bot.domain.Side;
import com.kalshi.bot.error.ExchangeRejectionException;
import com.kalshi.bot.error.TransientChannelException;
import com.kalshi.bot.infra.ExchangeTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.*;

class OrderLifecycleManagerTest {

    private ExchangeTransport transport;
    private ApplicationEventPublisher publisher;
    private PortfolioLedger ledger;
    private ShutdownSignal shutdownSignal;
    private TradingProperties properties;

    @BeforeEach
    void setUp() {
        transport = mock(ExchangeTransport.class);
        publisher = mock(ApplicationEventPublisher.class);
        ledger = new PortfolioLedger(new BigDecimal("100000"), BigDecimal.ZERO, Clock.systemUTC());
        shutdownSignal = new ShutdownSignal();
        properties = new TradingProperties();
        properties.setDryRun(false);
        properties.getOrders().setPollInterval(Duration.ofMillis(10));
    }

    private OrderLifecycleManager manager() {
        RateGate gate = new RateGate(1000, 10, Duration.ofSeconds(1));
        ExchangeChannel channel = new ExchangeChannel(transport, gate, 2, Duration.ofMillis(1), shutdownSignal);
        return new OrderLifecycleManager(channel, ledger, shutdownSignal, publisher, Clock.systemUTC(), properties);
    }

    private static OrderRequest buy(String key, int quantity) {
        return OrderRequest.builder()
                .clientOrderId(key)
                .marketId("MKT-A")
                .side(Side.YES)
                .action(OrderAction.BUY)
                .priceCents(70)
                .quantity(quantity)
                .build();
    }

    private static OrderStatusReport report(OrderStatus status, int filled) {
        return OrderStatusReport.builder()
                .orderId("ex-1")
                .status(status)
                .filledQuantity(filled)
                .averageFillPrice(filled > 0 ? new BigDecimal("70") : null)
                .build();
    }

    @Test
    void testOrderTrackedToFill() {
        when(transport.submitOrder(any())).thenReturn("ex-1");
        when(transport.getOrder("ex-1"))
                .thenReturn(report(OrderStatus.PENDING, 0))
                .thenReturn(report(OrderStatus.PENDING, 4))
                .thenReturn(report(OrderStatus.FILLED, 10));
        ledger.tryClaimEntry("MKT-A", 10);

        Order order = manager().placeAndTrack(buy("entry-1", 10), Duration.ofSeconds(5));

        assertEquals(OrderStatus.FILLED, order.getStatus());
        assertEquals(10, order.getFilledQuantity());
        assertTrue(order.isTerminal());
        assertEquals(10, ledger.position("MKT-A").orElseThrow().getQuantity());
        assertEquals(0, ledger.pendingEntryCount());
        verify(transport, never()).cancelOrder(any());
        verify(publisher).publishEvent(isA(OrderCompletedEvent.class));
    }

    @Test
    void testFillArrivingAfterTimeoutIsNotOverstated() {
        AtomicBoolean cancelled = new AtomicBoolean();
        when(transport.submitOrder(any())).thenReturn("ex-1");
        doAnswer(inv -> {
            cancelled.set(true);
            return null;
        }).when(transport).cancelOrder("ex-1");
        // three contracts fill just after the deadline, before the cancel lands
        when(transport.getOrder("ex-1")).thenAnswer(inv -> cancelled.get()
                ? report(OrderStatus.CANCELED, 3)
                : report(OrderStatus.PENDING, 0));
        ledger.tryClaimEntry("MKT-A", 10);

        Order order = manager().placeAndTrack(buy("entry-1", 10), Duration.ofMillis(50));

        assertEquals(OrderStatus.PARTIALLY_FILLED, order.getStatus());
        assertEquals(3, order.getFilledQuantity());
        assertTrue(order.isTerminal());
        assertEquals(3, ledger.position("MKT-A").orElseThrow().getQuantity());
        verify(transport).cancelOrder("ex-1");
    }

    @Test
    void testRefusedStatusPollKeepsTrackingAndBooksFills() {
        AtomicBoolean cancelled = new AtomicBoolean();
        when(transport.submitOrder(any())).thenReturn("ex-1");
        doAnswer(inv -> {
            cancelled.set(true);
            return null;
        }).when(transport).cancelOrder("ex-1");
        // the exchange does not know the order yet on the first poll
        when(transport.getOrder("ex-1"))
                .thenThrow(new ExchangeRejectionException("404 order not found", 404))
                .thenAnswer(inv -> cancelled.get()
                        ? report(OrderStatus.CANCELED, 4)
                        : report(OrderStatus.PENDING, 4));
        ledger.tryClaimEntry("MKT-A", 10);

        Order order = manager().placeAndTrack(buy("entry-1", 10), Duration.ofMillis(100));

        assertEquals(OrderStatus.PARTIALLY_FILLED, order.getStatus());
        assertEquals(4, order.getFilledQuantity());
        verify(transport).cancelOrder("ex-1");
        assertEquals(4, ledger.position("MKT-A").orElseThrow().getQuantity());
        assertEquals(0, ledger.pendingEntryCount());
    }

    @Test
    void testUnexpectedTrackingFailureCancelsAndBooksFills() {
        when(transport.submitOrder(any())).thenReturn("ex-1");
        when(transport.getOrder("ex-1"))
                .thenReturn(report(OrderStatus.PENDING, 4))
                .thenThrow(new IllegalStateException("malformed status payload"))
                .thenReturn(report(OrderStatus.CANCELED, 4));
        ledger.tryClaimEntry("MKT-A", 10);

        Order order = manager().placeAndTrack(buy("entry-1", 10), Duration.ofSeconds(5));

        assertTrue(order.isTerminal());
        assertEquals(OrderStatus.PARTIALLY_FILLED, order.getStatus());
        assertEquals(4, order.getFilledQuantity());
        verify(transport).cancelOrder("ex-1");
        assertEquals(4, ledger.position("MKT-A").orElseThrow().getQuantity());
        assertEquals(0, ledger.pendingEntryCount());
    }

    @Test
    void testUnfilledOrderExpires() {
        when(transport.submitOrder(any())).thenReturn("ex-1");
        when(transport.getOrder("ex-1")).thenReturn(report(OrderStatus.PENDING, 0));
        ledger.tryClaimEntry("MKT-A", 10);

        Order order = manager().placeAndTrack(buy("entry-1", 10), Duration.ofMillis(50));

        assertEquals(OrderStatus.EXPIRED, order.getStatus());
        assertEquals(0, order.getFilledQuantity());
        assertTrue(ledger.position("MKT-A").isEmpty());
        assertEquals(0, ledger.pendingEntryCount());
    }

    @Test
    void testExchangeRejectionIsTerminal() {
        when(transport.submitOrder(any())).thenThrow(new ExchangeRejectionException("insufficient_balance", 400));
        ledger.tryClaimEntry("MKT-A", 10);

        Order order = manager().placeAndTrack(buy("entry-1", 10), Duration.ofSeconds(5));

        assertEquals(OrderStatus.REJECTED, order.getStatus());
        assertTrue(order.getFailureReason().contains("insufficient_balance"));
        verify(transport, times(1)).submitOrder(any());
        verify(transport, never()).getOrder(any());
        assertEquals(0, ledger.pendingEntryCount());
    }

    @Test
    void testTransientSubmitFailureIsRetriedThenRejected() {
        when(transport.submitOrder(any())).thenThrow(new TransientChannelException("HTTP 503"));

        Order order = manager().placeAndTrack(buy("entry-1", 10), Duration.ofSeconds(5));

        assertEquals(OrderStatus.REJECTED, order.getStatus());
        verify(transport, times(3)).submitOrder(any());
    }

    @Test
    void testSecondCallWithSameKeyJoinsTheFirst() throws Exception {
        AtomicBoolean filled = new AtomicBoolean();
        when(transport.submitOrder(any())).thenReturn("ex-1");
        when(transport.getOrder("ex-1")).thenAnswer(inv -> filled.get()
                ? report(OrderStatus.FILLED, 10)
                : report(OrderStatus.PENDING, 0));
        OrderLifecycleManager manager = manager();

        CompletableFuture<Order> first = CompletableFuture.supplyAsync(
                () -> manager.placeAndTrack(buy("entry-1", 10), Duration.ofSeconds(10)));
        verify(transport, timeout(2000).atLeastOnce()).getOrder("ex-1");
        assertEquals(1, manager.inFlightCount());

        CompletableFuture<Order> second = CompletableFuture.supplyAsync(
                () -> manager.placeAndTrack(buy("entry-1", 10), Duration.ofSeconds(10)));
        Thread.sleep(200);
        filled.set(true);

        Order a = first.get(5, TimeUnit.SECONDS);
        Order b = second.get(5, TimeUnit.SECONDS);
        assertSame(a, b);
        assertEquals(OrderStatus.FILLED, a.getStatus());
        verify(transport, times(1)).submitOrder(any());
        assertEquals(10, ledger.position("MKT-A").orElseThrow().getQuantity());
        assertEquals(0, manager.inFlightCount());
    }

    @Test
    void testShutdownCancelsWorkingOrder() throws Exception {
        AtomicBoolean cancelled = new AtomicBoolean();
        when(transport.submitOrder(any())).thenReturn("ex-1");
        doAnswer(inv -> {
            cancelled.set(true);
            return null;
        }).when(transport).cancelOrder("ex-1");
        when(transport.getOrder("ex-1")).thenAnswer(inv -> cancelled.get()
                ? report(OrderStatus.CANCELED, 0)
                : report(OrderStatus.PENDING, 0));
        OrderLifecycleManager manager = manager();

        CompletableFuture<Order> running = CompletableFuture.supplyAsync(
                () -> manager.placeAndTrack(buy("entry-1", 10), Duration.ofMinutes(5)));
        verify(transport, timeout(2000).atLeastOnce()).getOrder("ex-1");
        shutdownSignal.trigger();

        Order order = running.get(5, TimeUnit.SECONDS);
        assertEquals(OrderStatus.CANCELED, order.getStatus());
        verify(transport).cancelOrder("ex-1");
    }

    @Test
    void testNoSubmissionAfterShutdown() {
        shutdownSignal.trigger();

        Order order = manager().placeAndTrack(buy("entry-1", 10), Duration.ofSeconds(5));

        assertEquals(OrderStatus.REJECTED, order.getStatus());
        verifyNoInteractions(transport);
    }

    @Test
    void testDryRunFillsSyntheticallyAndClosesPosition() {
        properties.setDryRun(true);
        OrderLifecycleManager manager = manager();

        Order entry = manager.placeAndTrack(buy("entry-1", 10), Duration.ofSeconds(5));
        assertEquals(OrderStatus.FILLED, entry.getStatus());
        assertEquals(0, new BigDecimal("70").compareTo(entry.getAverageFillPrice()));

        ledger.beginClose("MKT-A");
        Order exit = manager.placeAndTrack(OrderRequest.builder()
                .clientOrderId("exit-1")
                .marketId("MKT-A")
                .side(Side.YES)
                .action(OrderAction.SELL)
                .priceCents(80)
                .quantity(10)
                .build(), Duration.ofSeconds(5));

        assertEquals(OrderStatus.FILLED, exit.getStatus());
        assertTrue(ledger.position("MKT-A").isEmpty());
        assertEquals(0, new BigDecimal("100").compareTo(ledger.snapshot().getRealizedPnl()));
        verify(publisher).publishEvent(isA(PositionClosedEvent.class));
        verifyNoInteractions(transport);
    }
}

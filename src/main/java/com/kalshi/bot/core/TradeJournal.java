package com.kalshi.bot.core;

import com.kalshi.bot.domain.Order;
import com.kalshi.bot.domain.OrderAction;
import com.kalshi.bot.domain.OrderCompletedEvent;
import com.kalshi.bot.domain.Position;
import com.kalshi.bot.domain.PositionClosedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.RoundingMode;

/**
 * Writes one line per completed order and per closed position to the
 * {@code trades} logger.
 */
@Slf4j(topic = "trades")
@Component
public class TradeJournal {

    @EventListener
    public void onOrderCompleted(OrderCompletedEvent event) {
        Order order = event.getOrder();
        if (order.getFilledQuantity() == 0) {
            return;
        }
        log.info("{} | {} | {} | x{} @ {}c | {}", order.getAction() == OrderAction.BUY ? "ENTRY" : "EXIT",
                order.getMarketId(), order.getSide(), order.getFilledQuantity(),
                order.getAverageFillPrice().setScale(2, RoundingMode.HALF_EVEN), order.getStatus());
    }

    @EventListener
    public void onPositionClosed(PositionClosedEvent event) {
        Position position = event.getPosition();
        log.info("CLOSED | {} | {} | P&L {}c | held since {}", position.getMarketId(), position.getSide(),
                position.getRealizedPnl().setScale(2, RoundingMode.HALF_EVEN), position.getEnteredAt());
    }
}

package com.kalshi.bot.core;

import com.kalshi.bot.config.TradingProperties;
import com.kalshi.bot.domain.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Decides whether an open position should be closed at the current mark.
 *
 * <p>Profit target: {@code (mark - entry) / entry >= profitTarget}. Stop-loss,
 * when configured and only on markets trading at least
 * {@code stopLossMinVolume}: {@code (entry - mark) / entry >= stopLoss}. If
 * both hold, {@link ExitPrecedence} picks the winner.
 */
@Slf4j
@Component
public class ExitPolicy {

    private final TradingProperties.Exit settings;

    public ExitPolicy(TradingProperties properties) {
        this.settings = properties.getExit();
    }

    public Optional<ExitDecision> evaluate(Position position, BigDecimal mark, long volume) {
        BigDecimal entry = position.getAverageEntryPrice();
        if (mark == null || entry.signum() <= 0) {
            return Optional.empty();
        }

        BigDecimal pnlPercent = mark.subtract(entry).divide(entry, 6, RoundingMode.HALF_EVEN);
        boolean profitHit = pnlPercent.compareTo(settings.getProfitTargetPercent()) >= 0;
        boolean stopHit = stopLossApplies(position, volume)
                && pnlPercent.negate().compareTo(settings.getStopLossPercent()) >= 0;

        ExitReason reason;
        if (profitHit && stopHit) {
            reason = settings.getPrecedence() == ExitPrecedence.STOP_LOSS_FIRST
                    ? ExitReason.STOP_LOSS : ExitReason.PROFIT_TARGET;
            log.warn("[EXIT] {} hit both profit target and stop-loss at mark {}c (entry {}c), taking {}",
                    position.getMarketId(), mark, entry, reason);
        } else if (profitHit) {
            reason = ExitReason.PROFIT_TARGET;
        } else if (stopHit) {
            reason = ExitReason.STOP_LOSS;
        } else {
            return Optional.empty();
        }

        int price = mark.setScale(0, RoundingMode.FLOOR).intValue();
        price = Math.max(1, Math.min(99, price));
        return Optional.of(new ExitDecision(reason, price, pnlPercent));
    }

    private boolean stopLossApplies(Position position, long volume) {
        if (settings.getStopLossPercent() == null) {
            return false;
        }
        if (volume < settings.getStopLossMinVolume()) {
            log.debug("[EXIT] Stop-loss skipped for {}: volume {} < {}", position.getMarketId(), volume,
                    settings.getStopLossMinVolume());
            return false;
        }
        return true;
    }
}

package com.kalshi.bot.core;

import com.kalshi.bot.config.TradingProperties;
import com.kalshi.bot.domain.Opportunity;
import com.kalshi.bot.domain.PortfolioSnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns an opportunity into a contract count. Pure: reads only its arguments
 * and the sizing configuration.
 *
 * <p>With compounding on, the base is the portfolio's current total value;
 * otherwise the baseline captured when the ledger was opened. The target is
 * {@code maxPositionPercent} of the base (never less than
 * {@code minPositionPercent}), capped by available cash.
 */
@Component
public class PositionSizer {

    private final TradingProperties.Sizing sizing;
    private final int maxConcurrentPositions;

    public PositionSizer(TradingProperties properties) {
        this.sizing = properties.getSizing();
        this.maxConcurrentPositions = properties.getMaxConcurrentPositions();
        if (sizing.getMinPositionPercent().compareTo(sizing.getMaxPositionPercent()) > 0) {
            throw new IllegalStateException("trading.sizing.min-position-percent exceeds max-position-percent");
        }
    }

    public SizingDecision size(PortfolioSnapshot snapshot, Opportunity opportunity) {
        if (snapshot.getOpenPositions() >= maxConcurrentPositions) {
            return SizingDecision.rejected(RejectionReason.CAP_REACHED,
                    snapshot.getOpenPositions() + "/" + maxConcurrentPositions + " positions open");
        }

        int priceCents = opportunity.getPriceCents();
        if (priceCents > sizing.getMaxPriceCents()) {
            return SizingDecision.rejected(RejectionReason.PRICE_ABOVE_CAP,
                    priceCents + "c > cap " + sizing.getMaxPriceCents() + "c");
        }

        BigDecimal base = sizing.isCompounding() ? snapshot.totalValue() : snapshot.getBaselineValue();
        BigDecimal cash = snapshot.getCash();
        BigDecimal price = BigDecimal.valueOf(priceCents);

        BigDecimal minimumSpend = price.multiply(BigDecimal.valueOf(sizing.getMinContracts()));
        if (base.signum() <= 0 || cash.compareTo(minimumSpend) < 0) {
            return SizingDecision.rejected(RejectionReason.INSUFFICIENT_FUNDS,
                    "cash " + cash + "c cannot buy " + sizing.getMinContracts() + " @ " + priceCents + "c");
        }

        BigDecimal floor = base.multiply(sizing.getMinPositionPercent());
        if (cash.compareTo(floor) < 0) {
            return SizingDecision.rejected(RejectionReason.INSUFFICIENT_FUNDS,
                    "cash " + cash + "c below minimum position " + floor.setScale(2, RoundingMode.HALF_EVEN) + "c");
        }

        BigDecimal target = base.multiply(sizing.getMaxPositionPercent()).max(floor).min(cash);
        int contracts = target.divide(price, 0, RoundingMode.FLOOR).intValueExact();
        if (sizing.getMaxContracts() > 0) {
            contracts = Math.min(contracts, sizing.getMaxContracts());
        }

        if (contracts < sizing.getMinContracts()) {
            return SizingDecision.rejected(RejectionReason.BELOW_MIN_CONTRACTS,
                    contracts + " < min " + sizing.getMinContracts() + " (target " + target + "c)");
        }
        return SizingDecision.sized(contracts, priceCents);
    }
}

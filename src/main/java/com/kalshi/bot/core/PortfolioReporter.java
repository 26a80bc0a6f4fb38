package com.kalshi.bot.core;

import com.kalshi.bot.domain.PerformanceReport;
import com.kalshi.bot.domain.PortfolioSnapshot;
import com.kalshi.bot.domain.Position;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Periodic portfolio status and the compounding summary printed at shutdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PortfolioReporter {

    private final PortfolioLedger ledger;

    @Scheduled(fixedDelayString = "${trading.report-interval:PT5M}", initialDelayString = "${trading.report-interval:PT5M}")
    public void logStatus() {
        PortfolioSnapshot snapshot = ledger.snapshot();
        log.info("Portfolio: value ${} | cash ${} | invested ${} | unrealized ${} | realized ${} | {} open",
                dollars(snapshot.totalValue()), dollars(snapshot.getCash()), dollars(snapshot.getCostBasis()),
                dollars(snapshot.getUnrealizedPnl()), dollars(snapshot.getRealizedPnl()),
                snapshot.getOpenPositions());
        for (Position position : ledger.openPositions()) {
            log.info("  {} {} x{} entry {}c mark {}c [{}]", position.getMarketId(), position.getSide(),
                    position.getQuantity(), position.getAverageEntryPrice().setScale(2, RoundingMode.HALF_EVEN),
                    position.getLastMark(), position.getStatus());
        }
        if (ledger.isHalted()) {
            log.error("Ledger is HALTED: {}", ledger.getHaltReason());
        }
    }

    @PreDestroy
    public void logSummary() {
        PerformanceReport report = ledger.performance();
        log.info("==== Session summary ====");
        log.info("Start ${} -> now ${} ({}%, x{})", dollars(report.getStartingValue()),
                dollars(report.getCurrentValue()), report.growthRate().movePointRight(2),
                report.compoundMultiplier());
        log.info("Closed trades: {} | winners: {} | win rate {}% | avg P&L ${}", report.getClosedTrades(),
                report.getWinningTrades(), report.winRate().movePointRight(2),
                dollars(report.averageProfitPerTrade()));
        log.info("Realized P&L: ${}", dollars(report.getRealizedPnl()));
    }

    static BigDecimal dollars(BigDecimal cents) {
        return cents.movePointLeft(2).setScale(2, RoundingMode.HALF_EVEN);
    }
}

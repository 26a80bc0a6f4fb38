package com.kalshi.bot.config;

import com.kalshi.bot.core.ExitPrecedence;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Strategy and execution thresholds, bound from {@code trading.*}.
 */
@Data
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    /** Fill orders synthetically at the requested price instead of sending them. */
    private boolean dryRun = true;

    /** Starting cash for the ledger in dry-run mode. */
    private BigDecimal dryRunBalanceCents = new BigDecimal("100000");

    private int maxConcurrentPositions = 10;

    /** Markets closing sooner than this are not entered. Zero disables the rule. */
    private Duration entryCutoff = Duration.ZERO;

    private BigDecimal feePerContractCents = BigDecimal.ZERO;

    private Sizing sizing = new Sizing();
    private Exit exit = new Exit();
    private Orders orders = new Orders();
    private Monitor monitor = new Monitor();
    private Channel channel = new Channel();
    private Scanner scanner = new Scanner();

    @Data
    public static class Sizing {
        private BigDecimal minPositionPercent = new BigDecimal("0.02");
        private BigDecimal maxPositionPercent = new BigDecimal("0.10");
        private int minContracts = 1;
        private int maxContracts = 0; // 0 = unbounded
        private boolean compounding = true;
        private int maxPriceCents = 95;
    }

    @Data
    public static class Exit {
        private BigDecimal profitTargetPercent = new BigDecimal("0.065");
        private BigDecimal stopLossPercent; // null disables stop-loss
        private long stopLossMinVolume = 100_000;
        private ExitPrecedence precedence = ExitPrecedence.PROFIT_TARGET_FIRST;
    }

    @Data
    public static class Orders {
        private Duration entryTimeout = Duration.ofMinutes(5);
        private Duration exitTimeout = Duration.ofMinutes(2);
        private Duration pollInterval = Duration.ofSeconds(2);
    }

    @Data
    public static class Monitor {
        private Duration cadence = Duration.ofSeconds(15);
        private Duration fetchTimeout = Duration.ofSeconds(10);
        private int threads = 4;
        private Duration shutdownGrace = Duration.ofMinutes(3);
    }

    @Data
    public static class Channel {
        private double permitsPerSecond = 10.0;
        private int burst = 1;
        private Duration maxWait = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private Duration retryBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class Scanner {
        private BigDecimal minProbability = new BigDecimal("0.80");
        private BigDecimal maxProbability = new BigDecimal("0.90");
        private BigDecimal minLiquidityCents = BigDecimal.ZERO;
        private long minVolume = 0;
        private int maxHoursUntilClose = 24; // 0 = no limit
        private int pageSize = 100;
        private int maxPages = 20;
    }
}

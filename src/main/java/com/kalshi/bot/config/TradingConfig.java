package com.kalshi.bot.config;

import com.kalshi.bot.core.ExchangeChannel;
import com.kalshi.bot.core.PortfolioLedger;
import com.kalshi.bot.core.RateGate;
import com.kalshi.bot.core.ShutdownSignal;
import com.kalshi.bot.domain.ExchangePosition;
import com.kalshi.bot.infra.ExchangeTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

@Slf4j
@Configuration
public class TradingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateGate rateGate(TradingProperties properties) {
        TradingProperties.Channel channel = properties.getChannel();
        return new RateGate(channel.getPermitsPerSecond(), channel.getBurst(), channel.getMaxWait());
    }

    @Bean
    public ExchangeChannel exchangeChannel(ExchangeTransport transport, RateGate rateGate,
            ShutdownSignal shutdownSignal, TradingProperties properties) {
        TradingProperties.Channel channel = properties.getChannel();
        return new ExchangeChannel(transport, rateGate, channel.getMaxRetries(), channel.getRetryBackoff(),
                shutdownSignal);
    }

    /**
     * The ledger starts from the configured dry-run balance, or from the live
     * account balance plus whatever the account already holds when trading
     * for real.
     */
    @Bean
    public PortfolioLedger portfolioLedger(ExchangeChannel channel, TradingProperties properties, Clock clock) {
        if (properties.isDryRun()) {
            BigDecimal startingCash = properties.getDryRunBalanceCents();
            log.info("[DRY-RUN] Orders are simulated. Starting balance ${}", startingCash.movePointLeft(2));
            return new PortfolioLedger(startingCash, properties.getFeePerContractCents(), clock);
        }
        BigDecimal balance = channel.getBalance();
        List<ExchangePosition> held = channel.getPositions();
        log.info("LIVE trading. Account balance ${}, {} positions held", balance.movePointLeft(2), held.size());
        for (ExchangePosition position : held) {
            log.info("  adopting {} {} x{} (cost {}c)", position.getMarketId(), position.getSide(),
                    position.getQuantity(), position.getCostCents());
        }
        return new PortfolioLedger(balance, held, properties.getFeePerContractCents(), clock);
    }
}

package com.kalshi.bot;

import com.kalshi.bot.config.KalshiProperties;
import com.kalshi.bot.config.TradingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({TradingProperties.class, KalshiProperties.class})
public class KalshiCompoundApplication {

    public static void main(String[] args) {
        System.setProperty("java.net.preferIPv4Stack", "true"); // OkHttp on dual-stack hosts
        SpringApplication.run(KalshiCompoundApplication.class, args);
    }

}

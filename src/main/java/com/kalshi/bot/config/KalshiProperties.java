package com.kalshi.bot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "kalshi")
public class KalshiProperties {
    private String baseUrl = "https://api.elections.kalshi.com/trade-api/v2";
    private String apiKeyId = "";
    private String privateKeyPath = "";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(20);
}

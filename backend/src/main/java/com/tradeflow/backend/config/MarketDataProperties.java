package com.tradeflow.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "market-data")
@Data
@Validated
public class MarketDataProperties {

    private boolean simulated = true;

    @Positive
    private long pollIntervalMs = 5000;

    @Positive
    private double volatility = 0.002;

    @Min(50)
    private int window = 100;

    private Map<String, Double> seedPrices = new HashMap<>(Map.of(
            "BTC/USDT", 60000.0,
            "ETH/USDT", 3000.0,
            "SOL/USDT", 150.0,
            "BNB/USDT", 550.0
    ));
}

package com.tradeflow.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
@Validated
public class PipelineProperties {

    @NotEmpty
    private List<String> instruments = new ArrayList<>(List.of("BTC/USDT", "ETH/USDT", "SOL/USDT", "BNB/USDT"));

    // Aligned with the fastest agent cadence (scalping, 30s)
    @Positive
    private long cycleIntervalMs = 30000;

    private boolean schedulerEnabled = true;

    @Min(1)
    private int bufferCapacity = 10000;

    @Min(1)
    private int decisionHistorySize = 200;

    @Positive
    private double defaultMaxQuantity = 1000000.0;

    private Map<String, Double> maxQuantity = new HashMap<>();

    // Per-agent trust weights, agents not listed weigh 1.0
    private Map<String, Double> trustWeights = new HashMap<>();
}

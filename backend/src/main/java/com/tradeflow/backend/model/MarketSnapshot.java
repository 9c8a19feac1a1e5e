package com.tradeflow.backend.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record MarketSnapshot(
        String instrument,
        BigDecimal price,
        Map<String, Double> indicators,
        Instant observedAt
) {

    public MarketSnapshot {
        indicators = indicators == null ? Map.of() : Map.copyOf(indicators);
    }

    public boolean isStale(Instant now, Duration maxAge) {
        return observedAt == null || observedAt.plus(maxAge).isBefore(now);
    }

    public Double indicator(String name) {
        return indicators.get(name);
    }
}

package com.tradeflow.backend.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the portfolio. Produced by the portfolio store only.
 */
public record PortfolioSnapshot(
        BigDecimal totalCapital,
        BigDecimal availableCapital,
        Map<String, Position> openPositions,
        BigDecimal dailyRealizedPnl,
        LocalDate tradingDay,
        long version,
        Instant asOf
) {

    public PortfolioSnapshot {
        openPositions = openPositions == null ? Map.of() : Map.copyOf(openPositions);
    }

    public Optional<Position> position(String instrument) {
        return Optional.ofNullable(openPositions.get(instrument));
    }
}

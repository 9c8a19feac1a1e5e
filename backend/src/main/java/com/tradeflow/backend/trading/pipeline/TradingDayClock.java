package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.config.RiskProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Process-wide daily boundary. A trading day starts at {@code risk.daily-reset-hour-utc}
 * and lasts 24 hours; the daily loss counter belongs to exactly one trading day.
 */
@Component
@RequiredArgsConstructor
public class TradingDayClock {

    private final Clock clock;
    private final RiskProperties riskProperties;

    public Instant now() {
        return clock.instant();
    }

    public LocalDate currentTradingDay() {
        return tradingDayOf(clock.instant());
    }

    public LocalDate tradingDayOf(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC)
                .minusHours(riskProperties.getDailyResetHourUtc())
                .toLocalDate();
    }
}

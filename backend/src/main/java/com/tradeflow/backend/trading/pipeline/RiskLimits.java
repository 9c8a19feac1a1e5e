package com.tradeflow.backend.trading.pipeline;

import java.math.BigDecimal;

public record RiskLimits(
        BigDecimal maxPositionSizeFraction,
        BigDecimal maxDailyLossFraction,
        BigDecimal stopLossFraction,
        BigDecimal takeProfitFraction,
        BigDecimal minTradableQuantity,
        int dailyResetHourUtc
) {}

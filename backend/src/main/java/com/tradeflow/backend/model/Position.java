package com.tradeflow.backend.model;

import java.math.BigDecimal;
import java.time.Instant;

public record Position(
        String instrument,
        String venue,
        Side side,
        BigDecimal quantity,
        BigDecimal entryPrice,
        BigDecimal stopLossPrice,
        BigDecimal takeProfitPrice,
        Instant openedAt
) {

    public boolean stopLossBreached(BigDecimal price) {
        if (stopLossPrice == null || price == null) {
            return false;
        }
        return side == Side.BUY
                ? price.compareTo(stopLossPrice) <= 0
                : price.compareTo(stopLossPrice) >= 0;
    }

    public boolean takeProfitReached(BigDecimal price) {
        if (takeProfitPrice == null || price == null) {
            return false;
        }
        return side == Side.BUY
                ? price.compareTo(takeProfitPrice) >= 0
                : price.compareTo(takeProfitPrice) <= 0;
    }
}

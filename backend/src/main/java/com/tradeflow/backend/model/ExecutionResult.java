package com.tradeflow.backend.model;

import java.math.BigDecimal;
import java.time.Instant;

public record ExecutionResult(
        String orderId,
        String instrument,
        String venue,
        OrderState state,
        BigDecimal requestedQuantity,
        BigDecimal filledQuantity,
        BigDecimal averagePrice,
        int venueAttempts,
        int fillUpdates,
        String reasonCode,
        String message,
        Instant completedAt
) {

    public boolean isSuccess() {
        return state == OrderState.FILLED;
    }
}

package com.tradeflow.backend.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One non-zero increment of filled quantity for an order.
 * {@code fillId} is unique per increment and makes application idempotent.
 */
public record FillEvent(
        String fillId,
        String orderId,
        String instrument,
        String venue,
        Side side,
        OrderPurpose purpose,
        BigDecimal quantity,
        BigDecimal price,
        BigDecimal stopLossPrice,
        BigDecimal takeProfitPrice,
        Instant filledAt
) {}

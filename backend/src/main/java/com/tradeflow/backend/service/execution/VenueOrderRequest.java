package com.tradeflow.backend.service.execution;

import com.tradeflow.backend.model.Side;
import com.tradeflow.backend.trading.pipeline.PriceConstraint;

import java.math.BigDecimal;

/**
 * One submission to a venue. {@code clientOrderId} is unique per submission so a
 * venue can de-duplicate a retried request.
 */
public record VenueOrderRequest(
        String clientOrderId,
        String orderId,
        String instrument,
        Side side,
        BigDecimal quantity,
        PriceConstraint priceConstraint,
        BigDecimal referencePrice
) {}

package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.model.OrderPurpose;
import com.tradeflow.backend.model.Side;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A candidate decision that passed risk validation. Owned by the execution
 * coordinator once approved.
 */
@Builder(toBuilder = true)
public record ApprovedOrder(
        String orderId,
        String decisionReference,
        String instrument,
        Side side,
        OrderPurpose purpose,
        BigDecimal requestedQuantity,
        BigDecimal approvedQuantity,
        BigDecimal referencePrice,
        String venue,
        PriceConstraint priceConstraint,
        BigDecimal stopLossPrice,
        BigDecimal takeProfitPrice,
        String rationale,
        Instant createdAt
) {

    public BigDecimal approvedNotional() {
        return approvedQuantity.multiply(referencePrice);
    }
}

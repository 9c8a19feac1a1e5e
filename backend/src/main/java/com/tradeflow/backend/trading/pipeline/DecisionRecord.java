package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.model.Side;

import java.math.BigDecimal;
import java.time.Instant;

public record DecisionRecord(
        long cycleId,
        String instrument,
        Side side,
        BigDecimal quantity,
        double confidence,
        Disposition disposition,
        String orderId,
        String reasonCode,
        String rationale,
        Instant decidedAt
) {

    public enum Disposition {
        APPROVED,
        REJECTED
    }
}

package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.model.Side;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A single agent's suggested trade for one instrument. Immutable once emitted.
 */
public record Proposal(
        String agentId,
        String instrument,
        Side side,
        BigDecimal suggestedQuantity,
        double confidence,
        String rationale,
        Instant generatedAt,
        BigDecimal referencePrice
) {

    public Proposal {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(generatedAt, "generatedAt");
        if (suggestedQuantity == null || suggestedQuantity.signum() <= 0) {
            throw new IllegalArgumentException("suggestedQuantity must be positive: " + suggestedQuantity);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        if (referencePrice == null || referencePrice.signum() <= 0) {
            throw new IllegalArgumentException("referencePrice must be positive: " + referencePrice);
        }
        rationale = rationale == null ? "" : rationale;
    }
}

package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.model.Side;

import java.math.BigDecimal;
import java.util.List;

/**
 * The aggregator's single ranked output for one instrument in one cycle.
 * {@code contributingProposals} is ordered by confidence, highest first.
 */
public record CandidateDecision(
        long cycleId,
        String instrument,
        Side side,
        BigDecimal quantity,
        double confidence,
        BigDecimal referencePrice,
        List<Proposal> contributingProposals,
        String rationale
) {

    public CandidateDecision {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
        contributingProposals = List.copyOf(contributingProposals);
    }

    public String reference() {
        return cycleId + ":" + instrument;
    }
}

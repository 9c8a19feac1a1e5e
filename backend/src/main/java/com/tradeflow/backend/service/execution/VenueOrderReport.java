package com.tradeflow.backend.service.execution;

import java.math.BigDecimal;

/**
 * Venue view of one submission. Quantities are cumulative for that submission.
 */
public record VenueOrderReport(
        String venueOrderId,
        Status status,
        BigDecimal cumulativeFilledQuantity,
        BigDecimal averagePrice,
        String message
) {

    public enum Status {
        ACCEPTED,
        PARTIALLY_FILLED,
        FILLED,
        REJECTED
    }

    public boolean isOpen() {
        return status == Status.ACCEPTED;
    }
}

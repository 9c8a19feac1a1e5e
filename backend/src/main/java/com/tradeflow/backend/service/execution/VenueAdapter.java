package com.tradeflow.backend.service.execution;

/**
 * Order-submission contract for one trading venue. Failures must be thrown as
 * {@link com.tradeflow.backend.exception.TransientVenueException} or
 * {@link com.tradeflow.backend.exception.PermanentVenueException}.
 */
public interface VenueAdapter {

    String name();

    VenueOrderReport submitOrder(VenueOrderRequest request);

    VenueOrderReport getOrderStatus(String venueOrderId);

    /**
     * Withdraws an order the coordinator has stopped tracking. Venues without
     * resting orders need not override this.
     */
    default void cancelOrder(String venueOrderId) {
    }
}

package com.tradeflow.backend.exception;

/**
 * Non-retryable venue failure: invalid order, insufficient venue balance.
 */
public class PermanentVenueException extends VenueException {

    public PermanentVenueException(String venue, String code, String message) {
        super(venue, code, message);
    }

    public PermanentVenueException(String venue, String code, String message, Throwable cause) {
        super(venue, code, message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}

package com.tradeflow.backend.exception;

/**
 * Retryable venue failure: timeouts, rate limits, connectivity.
 */
public class TransientVenueException extends VenueException {

    public TransientVenueException(String venue, String code, String message) {
        super(venue, code, message);
    }

    public TransientVenueException(String venue, String code, String message, Throwable cause) {
        super(venue, code, message, cause);
    }

    public static TransientVenueException timeout(String venue, String operation, long timeoutMs) {
        return new TransientVenueException(venue, "TIMEOUT", operation + " timed out after " + timeoutMs + "ms");
    }

    public static TransientVenueException rateLimited(String venue, String message) {
        return new TransientVenueException(venue, "RATE_LIMITED", message);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}

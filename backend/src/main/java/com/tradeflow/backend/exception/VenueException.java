package com.tradeflow.backend.exception;

/**
 * Base type for venue call failures. Adapters must throw one of the two
 * subclasses so the execution coordinator can tell retryable failures apart.
 */
public abstract class VenueException extends TradingException {
    private final String venue;
    private final String code;

    protected VenueException(String venue, String code, String message) {
        super(message);
        this.venue = venue;
        this.code = code;
    }

    protected VenueException(String venue, String code, String message, Throwable cause) {
        super(message, cause);
        this.venue = venue;
        this.code = code;
    }

    public String getVenue() {
        return venue;
    }

    public String getCode() {
        return code;
    }

    public abstract boolean isTransient();
}

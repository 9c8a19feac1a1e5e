package com.tradeflow.backend.service.execution;

import com.tradeflow.backend.exception.VenueException;

/**
 * Outcome of one venue operation after its retry budget has been applied.
 */
record VenueCallResult<T>(Kind kind, T value, VenueException error) {

    enum Kind {
        SUCCESS,
        RETRY_EXHAUSTED,
        PERMANENT_FAILURE,
        CANCELLED
    }

    static <T> VenueCallResult<T> success(T value) {
        return new VenueCallResult<>(Kind.SUCCESS, value, null);
    }

    static <T> VenueCallResult<T> exhausted(VenueException error) {
        return new VenueCallResult<>(Kind.RETRY_EXHAUSTED, null, error);
    }

    static <T> VenueCallResult<T> permanent(VenueException error) {
        return new VenueCallResult<>(Kind.PERMANENT_FAILURE, null, error);
    }

    static <T> VenueCallResult<T> cancelled() {
        return new VenueCallResult<>(Kind.CANCELLED, null, null);
    }

    boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}

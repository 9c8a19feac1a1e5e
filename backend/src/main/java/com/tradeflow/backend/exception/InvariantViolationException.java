package com.tradeflow.backend.exception;

/**
 * A design-level invariant was about to be broken. Fatal to the affected
 * order only; callers escalate it to an operator alert.
 */
public class InvariantViolationException extends TradingException {
    private final String invariant;

    public InvariantViolationException(String invariant, String message) {
        super(message);
        this.invariant = invariant;
    }

    public String getInvariant() {
        return invariant;
    }
}

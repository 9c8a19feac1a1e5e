package com.tradeflow.backend.model;

/**
 * Order lifecycle state machine.
 * PARTIALLY_FILLED is not terminal: the remaining quantity is re-submitted.
 */
public enum OrderState {
    PENDING,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    REJECTED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FILLED || this == REJECTED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(OrderState target) {
        if (target == null) {
            return false;
        }
        if (this == target) {
            return true;
        }
        return switch (this) {
            case PENDING -> target == SUBMITTED || target == REJECTED || target == FAILED || target == CANCELLED;
            case SUBMITTED -> target == FILLED || target == PARTIALLY_FILLED || target == REJECTED
                    || target == FAILED || target == CANCELLED;
            case PARTIALLY_FILLED -> target == SUBMITTED || target == FILLED || target == REJECTED
                    || target == FAILED || target == CANCELLED;
            default -> false;
        };
    }
}

package com.tradeflow.backend.model;

/**
 * OPEN creates or adds to a position, CLOSE reduces an existing one.
 */
public enum OrderPurpose {
    OPEN,
    CLOSE
}

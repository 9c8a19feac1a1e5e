package com.tradeflow.backend.model;

import java.time.Instant;

public record TradingNotification(
        Type type,
        String instrument,
        String reference,
        String reasonCode,
        String message,
        Instant timestamp
) {

    public enum Type {
        EXECUTION,
        REJECTION,
        ALERT
    }
}

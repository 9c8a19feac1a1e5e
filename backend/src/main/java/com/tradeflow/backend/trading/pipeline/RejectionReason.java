package com.tradeflow.backend.trading.pipeline;

public enum RejectionReason {
    SIZE_TOO_SMALL,
    DAILY_LOSS_LIMIT_BREACHED,
    INSUFFICIENT_CAPITAL,
    DUPLICATE_POSITION
}

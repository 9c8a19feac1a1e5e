package com.tradeflow.backend.exception;

public class MarketDataUnavailableException extends TradingException {
    public MarketDataUnavailableException(String message) {
        super(message);
    }

    public MarketDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

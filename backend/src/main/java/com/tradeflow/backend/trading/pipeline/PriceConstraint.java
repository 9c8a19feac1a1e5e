package com.tradeflow.backend.trading.pipeline;

import java.math.BigDecimal;

public record PriceConstraint(OrderType orderType, BigDecimal limitPrice) {

    public enum OrderType {
        MARKET,
        LIMIT
    }

    public static PriceConstraint market() {
        return new PriceConstraint(OrderType.MARKET, null);
    }

    public static PriceConstraint limit(BigDecimal price) {
        return new PriceConstraint(OrderType.LIMIT, price);
    }
}

package com.tradeflow.backend.dto;

import com.tradeflow.backend.model.Side;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
public class PositionValuationDTO {
    private String instrument;
    private String venue;
    private Side side;
    private BigDecimal quantity;
    private BigDecimal entryPrice;
    // Latest market price, or the entry price when no snapshot exists
    private BigDecimal markPrice;
    private boolean marked;
    private BigDecimal exposure;
    private BigDecimal unrealizedPnl;
    private BigDecimal stopLossPrice;
    private BigDecimal takeProfitPrice;
    private Instant openedAt;
}

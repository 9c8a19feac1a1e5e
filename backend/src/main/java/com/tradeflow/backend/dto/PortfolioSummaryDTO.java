package com.tradeflow.backend.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
public class PortfolioSummaryDTO {
    private BigDecimal totalCapital;
    private BigDecimal availableCapital;
    private BigDecimal dailyRealizedPnl;
    private BigDecimal realizedPnl;
    private BigDecimal unrealizedPnl;
    private BigDecimal totalPnl;
    private BigDecimal totalExposure;
    private BigDecimal equity;
    private Map<String, PositionValuationDTO> openPositions;
    private LocalDate tradingDay;
    private long version;
    private Instant asOf;
}

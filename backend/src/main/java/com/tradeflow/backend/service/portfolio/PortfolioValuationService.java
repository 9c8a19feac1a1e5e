package com.tradeflow.backend.service.portfolio;

import com.tradeflow.backend.config.PortfolioProperties;
import com.tradeflow.backend.dto.PortfolioSummaryDTO;
import com.tradeflow.backend.dto.PositionValuationDTO;
import com.tradeflow.backend.model.MarketSnapshot;
import com.tradeflow.backend.model.PortfolioSnapshot;
import com.tradeflow.backend.model.Position;
import com.tradeflow.backend.model.Side;
import com.tradeflow.backend.service.marketdata.MarketSnapshotStore;
import com.tradeflow.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Marks open positions to the latest market snapshot for the outward portfolio view.
 * Read-only: never writes to the portfolio store.
 */
@Service
@RequiredArgsConstructor
public class PortfolioValuationService {

    private final PortfolioStore portfolioStore;
    private final MarketSnapshotStore snapshotStore;
    private final PortfolioProperties portfolioProperties;

    public PortfolioSummaryDTO summary() {
        PortfolioSnapshot snapshot = portfolioStore.snapshot();
        Map<String, PositionValuationDTO> positions = new TreeMap<>();
        BigDecimal exposure = MoneyUtils.ZERO;
        BigDecimal unrealized = MoneyUtils.ZERO;
        for (Position position : snapshot.openPositions().values()) {
            PositionValuationDTO valuation = value(position);
            positions.put(position.instrument(), valuation);
            exposure = MoneyUtils.add(exposure, valuation.getExposure());
            unrealized = MoneyUtils.add(unrealized, valuation.getUnrealizedPnl());
        }
        BigDecimal realized = MoneyUtils.subtract(snapshot.totalCapital(),
                MoneyUtils.bd(portfolioProperties.getInitialCapital()));
        return PortfolioSummaryDTO.builder()
                .totalCapital(snapshot.totalCapital())
                .availableCapital(snapshot.availableCapital())
                .dailyRealizedPnl(snapshot.dailyRealizedPnl())
                .realizedPnl(realized)
                .unrealizedPnl(unrealized)
                .totalPnl(MoneyUtils.add(realized, unrealized))
                .totalExposure(exposure)
                .equity(MoneyUtils.add(snapshot.totalCapital(), unrealized))
                .openPositions(positions)
                .tradingDay(snapshot.tradingDay())
                .version(snapshot.version())
                .asOf(snapshot.asOf())
                .build();
    }

    private PositionValuationDTO value(Position position) {
        Optional<BigDecimal> latest = snapshotStore.latest(position.instrument())
                .map(MarketSnapshot::price)
                .filter(MoneyUtils::isPositive);
        BigDecimal mark = latest.map(MoneyUtils::scale).orElse(position.entryPrice());
        BigDecimal diff = position.side() == Side.BUY
                ? MoneyUtils.subtract(mark, position.entryPrice())
                : MoneyUtils.subtract(position.entryPrice(), mark);
        return PositionValuationDTO.builder()
                .instrument(position.instrument())
                .venue(position.venue())
                .side(position.side())
                .quantity(position.quantity())
                .entryPrice(position.entryPrice())
                .markPrice(mark)
                .marked(latest.isPresent())
                .exposure(MoneyUtils.multiply(position.quantity(), mark))
                .unrealizedPnl(MoneyUtils.multiply(diff, position.quantity()))
                .stopLossPrice(position.stopLossPrice())
                .takeProfitPrice(position.takeProfitPrice())
                .openedAt(position.openedAt())
                .build();
    }
}

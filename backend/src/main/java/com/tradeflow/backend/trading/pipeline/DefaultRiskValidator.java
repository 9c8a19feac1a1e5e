package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.config.ExecutionProperties;
import com.tradeflow.backend.model.OrderPurpose;
import com.tradeflow.backend.model.PortfolioSnapshot;
import com.tradeflow.backend.model.Position;
import com.tradeflow.backend.model.Side;
import com.tradeflow.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.UUID;

/**
 * Pure risk gate. Checks run in a fixed order and stop at the first failure:
 * daily loss breaker, position size clamp, capital sufficiency, duplicate position.
 * An opposite-side decision against an open position becomes a closing order.
 */
@Service
@RequiredArgsConstructor
public class DefaultRiskValidator implements RiskValidator {

    private final ExecutionProperties executionProperties;
    private final TradingDayClock tradingDayClock;

    @Override
    public RiskVerdict validate(CandidateDecision decision, PortfolioSnapshot portfolio, RiskLimits limits) {
        BigDecimal totalCapital = MoneyUtils.scale(portfolio.totalCapital());

        BigDecimal pnl = effectiveDailyPnl(portfolio);
        BigDecimal lossLimit = MoneyUtils.multiply(limits.maxDailyLossFraction(), totalCapital);
        if (pnl.compareTo(lossLimit.negate()) <= 0) {
            return RiskVerdict.reject(RejectionReason.DAILY_LOSS_LIMIT_BREACHED,
                    "Daily realized pnl " + pnl + " reached loss limit -" + lossLimit
                            + "; " + decision.rationale());
        }

        PriceConstraint priceConstraint = priceConstraint(decision);
        BigDecimal sizingPrice = priceConstraint.limitPrice() == null
                ? decision.referencePrice()
                : decision.referencePrice().max(priceConstraint.limitPrice());
        BigDecimal maxNotional = MoneyUtils.multiply(limits.maxPositionSizeFraction(), totalCapital);
        BigDecimal maxQuantity = maxNotional.divide(sizingPrice, MoneyUtils.SCALE, RoundingMode.DOWN);
        BigDecimal quantity = MoneyUtils.floorQuantity(decision.quantity().min(maxQuantity));

        Optional<Position> existing = portfolio.position(decision.instrument());
        OrderPurpose purpose = existing.filter(p -> p.side() != decision.side()).isPresent()
                ? OrderPurpose.CLOSE
                : OrderPurpose.OPEN;
        if (purpose == OrderPurpose.CLOSE) {
            quantity = quantity.min(existing.get().quantity());
        }

        if (quantity.compareTo(limits.minTradableQuantity()) < 0) {
            return RiskVerdict.reject(RejectionReason.SIZE_TOO_SMALL,
                    "Clamped quantity " + quantity + " below minimum " + limits.minTradableQuantity()
                            + "; " + decision.rationale());
        }

        BigDecimal notional = MoneyUtils.multiply(quantity, sizingPrice);
        if (purpose == OrderPurpose.OPEN && notional.compareTo(MoneyUtils.scale(portfolio.availableCapital())) > 0) {
            return RiskVerdict.reject(RejectionReason.INSUFFICIENT_CAPITAL,
                    "Notional " + notional + " exceeds available capital " + MoneyUtils.scale(portfolio.availableCapital())
                            + "; " + decision.rationale());
        }

        if (purpose == OrderPurpose.OPEN && existing.isPresent()) {
            return RiskVerdict.reject(RejectionReason.DUPLICATE_POSITION,
                    "Open " + existing.get().side() + " position on " + existing.get().venue()
                            + " for " + decision.instrument() + "; " + decision.rationale());
        }

        String venue = purpose == OrderPurpose.CLOSE
                ? existing.get().venue()
                : executionProperties.getDefaultVenue();
        BigDecimal entry = decision.referencePrice();
        ApprovedOrder.ApprovedOrderBuilder order = ApprovedOrder.builder()
                .orderId(UUID.randomUUID().toString())
                .decisionReference(decision.reference())
                .instrument(decision.instrument())
                .side(decision.side())
                .purpose(purpose)
                .requestedQuantity(decision.quantity())
                .approvedQuantity(quantity)
                .referencePrice(entry)
                .venue(venue)
                .priceConstraint(priceConstraint)
                .rationale(decision.rationale())
                .createdAt(tradingDayClock.now());
        if (purpose == OrderPurpose.OPEN) {
            order.stopLossPrice(stopLoss(decision.side(), entry, limits.stopLossFraction()))
                    .takeProfitPrice(takeProfit(decision.side(), entry, limits.takeProfitFraction()));
        }
        return RiskVerdict.approve(order.build());
    }

    /**
     * A snapshot from an earlier trading day has not seen the reset yet; its
     * realized pnl belongs to a closed day.
     */
    private BigDecimal effectiveDailyPnl(PortfolioSnapshot portfolio) {
        if (portfolio.tradingDay() == null || !portfolio.tradingDay().equals(tradingDayClock.currentTradingDay())) {
            return MoneyUtils.ZERO;
        }
        return MoneyUtils.scale(portfolio.dailyRealizedPnl());
    }

    private PriceConstraint priceConstraint(CandidateDecision decision) {
        if (executionProperties.getOrderType() != PriceConstraint.OrderType.LIMIT) {
            return PriceConstraint.market();
        }
        BigDecimal offset = MoneyUtils.bd(executionProperties.getLimitOffsetFraction());
        BigDecimal factor = decision.side() == Side.BUY
                ? BigDecimal.ONE.add(offset)
                : BigDecimal.ONE.subtract(offset);
        return PriceConstraint.limit(MoneyUtils.multiply(decision.referencePrice(), factor));
    }

    static BigDecimal stopLoss(Side side, BigDecimal entry, BigDecimal fraction) {
        BigDecimal factor = side == Side.BUY ? BigDecimal.ONE.subtract(fraction) : BigDecimal.ONE.add(fraction);
        return MoneyUtils.multiply(entry, factor);
    }

    static BigDecimal takeProfit(Side side, BigDecimal entry, BigDecimal fraction) {
        BigDecimal factor = side == Side.BUY ? BigDecimal.ONE.add(fraction) : BigDecimal.ONE.subtract(fraction);
        return MoneyUtils.multiply(entry, factor);
    }
}

package com.tradeflow.backend.service.agent;

import com.tradeflow.backend.config.AgentProperties;
import com.tradeflow.backend.model.MarketSnapshot;
import com.tradeflow.backend.model.PortfolioSnapshot;
import com.tradeflow.backend.model.Side;
import com.tradeflow.backend.trading.pipeline.Proposal;
import com.tradeflow.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Shared cadence and sizing for the built-in agents. Suggested quantity is
 * {@code availableCapital * sizingFraction / price}.
 */
public abstract class AbstractProposer implements Proposer {

    private final String name;
    private final AgentProperties.Agent settings;
    protected final Clock clock;

    protected AbstractProposer(String name, AgentProperties.Agent settings, Clock clock) {
        this.name = name;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Duration cadence() {
        return Duration.ofSeconds(settings.getIntervalSeconds());
    }

    @Override
    public boolean isEnabled() {
        return settings.isEnabled();
    }

    protected Optional<Proposal> proposal(MarketSnapshot snapshot, PortfolioSnapshot portfolio,
                                          Side side, double confidence, String rationale) {
        BigDecimal price = snapshot.price();
        if (!MoneyUtils.isPositive(price) || !MoneyUtils.isPositive(portfolio.availableCapital())) {
            return Optional.empty();
        }
        BigDecimal budget = MoneyUtils.multiply(portfolio.availableCapital(), MoneyUtils.bd(settings.getSizingFraction()));
        BigDecimal quantity = MoneyUtils.floorQuantity(budget.divide(price, MoneyUtils.SCALE + 4, RoundingMode.DOWN));
        if (quantity.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(new Proposal(
                name,
                snapshot.instrument(),
                side,
                quantity,
                Math.max(0.0, Math.min(1.0, confidence)),
                rationale,
                clock.instant(),
                price
        ));
    }

    protected static boolean present(Double... values) {
        for (Double value : values) {
            if (value == null || value.isNaN()) {
                return false;
            }
        }
        return true;
    }
}

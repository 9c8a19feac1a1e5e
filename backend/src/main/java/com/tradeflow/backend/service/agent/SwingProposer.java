package com.tradeflow.backend.service.agent;

import com.tradeflow.backend.config.AgentProperties;
import com.tradeflow.backend.model.MarketSnapshot;
import com.tradeflow.backend.model.PortfolioSnapshot;
import com.tradeflow.backend.model.Side;
import com.tradeflow.backend.service.marketdata.Indicators;
import com.tradeflow.backend.trading.pipeline.Proposal;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Trend following on stacked moving averages, filtered by RSI so it does not
 * chase an overextended move.
 */
@Component
public class SwingProposer extends AbstractProposer {

    static final double CONFIDENCE = 0.70;

    public SwingProposer(AgentProperties agentProperties, Clock clock) {
        super("swing", agentProperties.getSwing(), clock);
    }

    @Override
    public Optional<Proposal> propose(MarketSnapshot snapshot, PortfolioSnapshot portfolio) {
        Double ma20 = snapshot.indicator(Indicators.MA_20);
        Double ma50 = snapshot.indicator(Indicators.MA_50);
        Double rsi = snapshot.indicator(Indicators.RSI_14);
        if (!present(ma20, ma50, rsi)) {
            return Optional.empty();
        }
        double close = snapshot.price().doubleValue();
        if (close > ma20 && ma20 > ma50 && rsi < 70) {
            return proposal(snapshot, portfolio, Side.BUY, CONFIDENCE,
                    String.format(Locale.ROOT, "uptrend close>ma20>ma50 rsi %.1f", rsi));
        }
        if (close < ma20 && ma20 < ma50 && rsi > 30) {
            return proposal(snapshot, portfolio, Side.SELL, CONFIDENCE,
                    String.format(Locale.ROOT, "downtrend close<ma20<ma50 rsi %.1f", rsi));
        }
        return Optional.empty();
    }
}

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

// Mean reversion: oversold below the 50-period average, overbought above it.
@Component
public class ResearchProposer extends AbstractProposer {

    static final double CONFIDENCE = 0.75;

    public ResearchProposer(AgentProperties agentProperties, Clock clock) {
        super("research", agentProperties.getResearch(), clock);
    }

    @Override
    public Optional<Proposal> propose(MarketSnapshot snapshot, PortfolioSnapshot portfolio) {
        Double ma50 = snapshot.indicator(Indicators.MA_50);
        Double rsi = snapshot.indicator(Indicators.RSI_14);
        if (!present(ma50, rsi)) {
            return Optional.empty();
        }
        double close = snapshot.price().doubleValue();
        if (rsi < 30 && close < ma50) {
            return proposal(snapshot, portfolio, Side.BUY, CONFIDENCE,
                    String.format(Locale.ROOT, "oversold rsi %.1f below ma50 %.4f", rsi, ma50));
        }
        if (rsi > 70 && close > ma50) {
            return proposal(snapshot, portfolio, Side.SELL, CONFIDENCE,
                    String.format(Locale.ROOT, "overbought rsi %.1f above ma50 %.4f", rsi, ma50));
        }
        return Optional.empty();
    }
}

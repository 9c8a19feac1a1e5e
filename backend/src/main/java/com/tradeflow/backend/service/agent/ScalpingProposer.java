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
 * Short-horizon momentum: a move of more than 0.2% on above-average volume.
 */
@Component
public class ScalpingProposer extends AbstractProposer {

    static final double MIN_CHANGE = 0.002;
    static final double MIN_VOLUME_RATIO = 1.5;

    public ScalpingProposer(AgentProperties agentProperties, Clock clock) {
        super("scalping", agentProperties.getScalping(), clock);
    }

    @Override
    public Optional<Proposal> propose(MarketSnapshot snapshot, PortfolioSnapshot portfolio) {
        Double change = snapshot.indicator(Indicators.CHANGE_5);
        Double volumeRatio = snapshot.indicator(Indicators.VOLUME_RATIO);
        if (!present(change, volumeRatio)) {
            return Optional.empty();
        }
        if (Math.abs(change) <= MIN_CHANGE || volumeRatio <= MIN_VOLUME_RATIO) {
            return Optional.empty();
        }
        Side side = change > 0 ? Side.BUY : Side.SELL;
        double confidence = Math.min(0.80, 0.60 + Math.abs(change) * 10.0);
        String rationale = String.format(Locale.ROOT, "momentum %.4f on volume ratio %.2f", change, volumeRatio);
        return proposal(snapshot, portfolio, side, confidence, rationale);
    }
}

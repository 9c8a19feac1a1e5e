package com.tradeflow.backend.service.agent;

import com.tradeflow.backend.model.MarketSnapshot;
import com.tradeflow.backend.model.PortfolioSnapshot;
import com.tradeflow.backend.trading.pipeline.Proposal;

import java.time.Duration;
import java.util.Optional;

/**
 * An analysis agent. Implementations are stateless with respect to the
 * portfolio: they read snapshots and never write anything.
 */
public interface Proposer {

    String name();

    Duration cadence();

    boolean isEnabled();

    Optional<Proposal> propose(MarketSnapshot snapshot, PortfolioSnapshot portfolio);
}

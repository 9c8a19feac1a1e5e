package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.model.PortfolioSnapshot;

public interface RiskValidator {
    RiskVerdict validate(CandidateDecision decision, PortfolioSnapshot portfolio, RiskLimits limits);
}

package com.tradeflow.backend.service;

import com.tradeflow.backend.model.ExecutionResult;
import com.tradeflow.backend.model.PortfolioSnapshot;
import com.tradeflow.backend.trading.pipeline.ApprovedOrder;
import com.tradeflow.backend.trading.pipeline.CandidateDecision;
import com.tradeflow.backend.trading.pipeline.Proposal;
import com.tradeflow.backend.trading.pipeline.RiskVerdict;

/**
 * Write-only persistence sink. Implementations must not throw into the pipeline.
 */
public interface TradeJournal {

    void recordProposal(Proposal proposal);

    void recordDecision(CandidateDecision decision);

    void recordRejection(CandidateDecision decision, RiskVerdict verdict);

    void recordApprovedOrder(ApprovedOrder order);

    void recordExecutionResult(ExecutionResult result);

    void upsertPortfolio(PortfolioSnapshot snapshot);
}

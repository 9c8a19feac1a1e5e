package com.tradeflow.backend.trading.pipeline;

import java.util.List;

public interface DecisionAggregator {
    List<CandidateDecision> aggregate(List<Proposal> proposals, long cycleId);
}

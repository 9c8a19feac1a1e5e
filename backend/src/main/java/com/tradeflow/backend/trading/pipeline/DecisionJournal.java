package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Most recent candidate decisions with their disposition, newest first.
 */
@Component
public class DecisionJournal {

    private final int capacity;
    private final Deque<DecisionRecord> records = new ArrayDeque<>();

    @Autowired
    public DecisionJournal(PipelineProperties pipelineProperties) {
        this(pipelineProperties.getDecisionHistorySize());
    }

    DecisionJournal(int capacity) {
        this.capacity = capacity;
    }

    public void approved(CandidateDecision decision, ApprovedOrder order, Instant at) {
        add(new DecisionRecord(decision.cycleId(), decision.instrument(), decision.side(), order.approvedQuantity(),
                decision.confidence(), DecisionRecord.Disposition.APPROVED, order.orderId(), null,
                decision.rationale(), at));
    }

    public void rejected(CandidateDecision decision, RiskVerdict verdict, Instant at) {
        add(new DecisionRecord(decision.cycleId(), decision.instrument(), decision.side(), decision.quantity(),
                decision.confidence(), DecisionRecord.Disposition.REJECTED, null, verdict.reason().name(),
                verdict.rationale(), at));
    }

    public synchronized List<DecisionRecord> recent(int limit) {
        List<DecisionRecord> result = new ArrayList<>(Math.min(limit, records.size()));
        Iterator<DecisionRecord> it = records.iterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    private synchronized void add(DecisionRecord record) {
        records.addFirst(record);
        while (records.size() > capacity) {
            records.removeLast();
        }
    }
}

package com.tradeflow.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeflow.backend.entity.JournalEntry;
import com.tradeflow.backend.entity.PortfolioSnapshotRecord;
import com.tradeflow.backend.model.ExecutionResult;
import com.tradeflow.backend.model.PortfolioSnapshot;
import com.tradeflow.backend.repository.JournalEntryRepository;
import com.tradeflow.backend.repository.PortfolioSnapshotRecordRepository;
import com.tradeflow.backend.trading.pipeline.ApprovedOrder;
import com.tradeflow.backend.trading.pipeline.CandidateDecision;
import com.tradeflow.backend.trading.pipeline.Proposal;
import com.tradeflow.backend.trading.pipeline.RiskVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class JpaTradeJournal implements TradeJournal {

    private final JournalEntryRepository journalEntryRepository;
    private final PortfolioSnapshotRecordRepository portfolioSnapshotRecordRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void recordProposal(Proposal proposal) {
        append(JournalEntry.EntryType.PROPOSAL, proposal.instrument(), proposal.agentId(), proposal);
    }

    @Override
    public void recordDecision(CandidateDecision decision) {
        append(JournalEntry.EntryType.CANDIDATE_DECISION, decision.instrument(), decision.reference(), decision);
    }

    @Override
    public void recordRejection(CandidateDecision decision, RiskVerdict verdict) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", verdict.reason() != null ? verdict.reason().name() : null);
        details.put("rationale", verdict.rationale());
        details.put("side", decision.side());
        details.put("quantity", decision.quantity());
        details.put("confidence", decision.confidence());
        append(JournalEntry.EntryType.RISK_REJECTION, decision.instrument(), decision.reference(), details);
    }

    @Override
    public void recordApprovedOrder(ApprovedOrder order) {
        append(JournalEntry.EntryType.APPROVED_ORDER, order.instrument(), order.orderId(), order);
    }

    @Override
    public void recordExecutionResult(ExecutionResult result) {
        append(JournalEntry.EntryType.EXECUTION_RESULT, result.instrument(), result.orderId(), result);
    }

    @Override
    public void upsertPortfolio(PortfolioSnapshot snapshot) {
        try {
            PortfolioSnapshotRecord record = PortfolioSnapshotRecord.builder()
                    .id(PortfolioSnapshotRecord.SINGLETON_ID)
                    .totalCapital(snapshot.totalCapital())
                    .availableCapital(snapshot.availableCapital())
                    .dailyRealizedPnl(snapshot.dailyRealizedPnl())
                    .tradingDay(snapshot.tradingDay())
                    .snapshotVersion(snapshot.version())
                    .positions(toJson(snapshot.openPositions()))
                    .updatedAt(clock.instant())
                    .build();
            portfolioSnapshotRecordRepository.save(record);
        } catch (RuntimeException e) {
            log.error("Failed to persist portfolio snapshot version={}", snapshot.version(), e);
        }
    }

    private void append(JournalEntry.EntryType type, String instrument, String referenceId, Object payload) {
        try {
            journalEntryRepository.save(JournalEntry.builder()
                    .entryType(type)
                    .instrument(instrument)
                    .referenceId(referenceId)
                    .recordedAt(clock.instant())
                    .payload(toJson(payload))
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to journal {} for {} ref={}", type, instrument, referenceId, e);
        }
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize journal payload {}", payload.getClass().getSimpleName(), e);
            return null;
        }
    }
}

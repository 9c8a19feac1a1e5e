package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.config.RiskProperties;
import com.tradeflow.backend.model.PortfolioSnapshot;
import com.tradeflow.backend.model.TradingNotification;
import com.tradeflow.backend.service.MetricsService;
import com.tradeflow.backend.service.NotificationSink;
import com.tradeflow.backend.service.TradeJournal;
import com.tradeflow.backend.service.execution.ExecutionCoordinator;
import com.tradeflow.backend.service.portfolio.PortfolioStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One evaluation per cycle boundary: drain, aggregate, validate and hand off.
 * Each decision is validated on the trading executor so instruments proceed
 * independently; the cycle thread never waits on venue I/O.
 */
@Slf4j
@Service
public class TradingCycleService {

    private final ProposalBuffer proposalBuffer;
    private final DecisionAggregator decisionAggregator;
    private final RiskValidator riskValidator;
    private final RiskProperties riskProperties;
    private final PortfolioStore portfolioStore;
    private final ExecutionCoordinator executionCoordinator;
    private final DecisionJournal decisionJournal;
    private final TradeJournal tradeJournal;
    private final NotificationSink notificationSink;
    private final MetricsService metricsService;
    private final Executor tradingExecutor;
    private final Clock clock;
    private final AtomicLong cycleSequence = new AtomicLong();

    public TradingCycleService(ProposalBuffer proposalBuffer,
                               DecisionAggregator decisionAggregator,
                               RiskValidator riskValidator,
                               RiskProperties riskProperties,
                               PortfolioStore portfolioStore,
                               ExecutionCoordinator executionCoordinator,
                               DecisionJournal decisionJournal,
                               TradeJournal tradeJournal,
                               NotificationSink notificationSink,
                               MetricsService metricsService,
                               @Qualifier("tradingExecutor") Executor tradingExecutor,
                               Clock clock) {
        this.proposalBuffer = proposalBuffer;
        this.decisionAggregator = decisionAggregator;
        this.riskValidator = riskValidator;
        this.riskProperties = riskProperties;
        this.portfolioStore = portfolioStore;
        this.executionCoordinator = executionCoordinator;
        this.decisionJournal = decisionJournal;
        this.tradeJournal = tradeJournal;
        this.notificationSink = notificationSink;
        this.metricsService = metricsService;
        this.tradingExecutor = tradingExecutor;
        this.clock = clock;
    }

    public CycleSummary runCycle() {
        long cycleId = cycleSequence.incrementAndGet();
        Instant boundary = clock.instant();
        MDC.put("cycleId", String.valueOf(cycleId));
        try {
            List<Proposal> proposals = proposalBuffer.drain(boundary);
            List<CandidateDecision> decisions = decisionAggregator.aggregate(proposals, cycleId);
            metricsService.recordCycle(proposals.size(), decisions.size());
            log.info("Cycle {} boundary={} proposals={} decisions={} carriedOver={}",
                    cycleId, boundary, proposals.size(), decisions.size(), proposalBuffer.size());

            List<CompletableFuture<RiskVerdict>> evaluations = decisions.stream()
                    .map(decision -> {
                        tradeJournal.recordDecision(decision);
                        return CompletableFuture.supplyAsync(() -> evaluate(decision), tradingExecutor);
                    })
                    .toList();
            return new CycleSummary(cycleId, boundary, proposals.size(), decisions, evaluations);
        } finally {
            MDC.remove("cycleId");
        }
    }

    RiskVerdict evaluate(CandidateDecision decision) {
        MDC.put("cycleId", String.valueOf(decision.cycleId()));
        MDC.put("instrument", decision.instrument());
        try {
            RiskVerdict verdict;
            if (executionCoordinator.isInFlight(decision.instrument())) {
                verdict = RiskVerdict.reject(RejectionReason.DUPLICATE_POSITION,
                        "Order already in flight for " + decision.instrument() + "; " + decision.rationale());
            } else {
                PortfolioSnapshot portfolio = portfolioStore.snapshot();
                verdict = riskValidator.validate(decision, portfolio, riskProperties.toLimits());
            }

            if (!verdict.approved()) {
                reject(decision, verdict);
                return verdict;
            }
            ApprovedOrder order = verdict.order();
            decisionJournal.approved(decision, order, clock.instant());
            log.info("Decision approved {} {} qty={} (requested {}) venue={} orderId={}",
                    decision.side(), decision.instrument(), order.approvedQuantity(), order.requestedQuantity(),
                    order.venue(), order.orderId());
            executionCoordinator.submit(order);
            return verdict;
        } catch (RuntimeException e) {
            log.error("Decision evaluation failed cycle={} instrument={}", decision.cycleId(), decision.instrument(), e);
            throw e;
        } finally {
            MDC.remove("cycleId");
            MDC.remove("instrument");
        }
    }

    private void reject(CandidateDecision decision, RiskVerdict verdict) {
        log.info("Decision rejected {} {} reason={} rationale={}",
                decision.side(), decision.instrument(), verdict.reason(), verdict.rationale());
        metricsService.recordReject(verdict.reason().name());
        decisionJournal.rejected(decision, verdict, clock.instant());
        tradeJournal.recordRejection(decision, verdict);
        notificationSink.publish(new TradingNotification(
                TradingNotification.Type.REJECTION,
                decision.instrument(),
                decision.reference(),
                verdict.reason().name(),
                verdict.rationale(),
                clock.instant()));
    }

    public record CycleSummary(
            long cycleId,
            Instant boundary,
            int proposals,
            List<CandidateDecision> decisions,
            List<CompletableFuture<RiskVerdict>> evaluations
    ) {}
}

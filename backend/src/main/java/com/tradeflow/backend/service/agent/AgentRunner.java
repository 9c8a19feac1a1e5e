package com.tradeflow.backend.service.agent;

import com.tradeflow.backend.config.AgentProperties;
import com.tradeflow.backend.config.PipelineProperties;
import com.tradeflow.backend.model.MarketSnapshot;
import com.tradeflow.backend.model.PortfolioSnapshot;
import com.tradeflow.backend.service.MetricsService;
import com.tradeflow.backend.service.TradeJournal;
import com.tradeflow.backend.service.marketdata.MarketSnapshotStore;
import com.tradeflow.backend.service.portfolio.PortfolioStore;
import com.tradeflow.backend.trading.pipeline.Proposal;
import com.tradeflow.backend.trading.pipeline.ProposalBuffer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs every enabled agent as its own periodic task. A slow or failing agent
 * never delays another one.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "agents.enabled", havingValue = "true", matchIfMissing = true)
public class AgentRunner {

    private final List<Proposer> proposers;
    private final TaskScheduler agentScheduler;
    private final MarketSnapshotStore snapshotStore;
    private final PortfolioStore portfolioStore;
    private final ProposalBuffer proposalBuffer;
    private final TradeJournal tradeJournal;
    private final AgentHealthRegistry healthRegistry;
    private final MetricsService metricsService;
    private final PipelineProperties pipelineProperties;
    private final AgentProperties agentProperties;
    private final Clock clock;
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();

    public AgentRunner(List<Proposer> proposers,
                       @Qualifier("agentScheduler") TaskScheduler agentScheduler,
                       MarketSnapshotStore snapshotStore,
                       PortfolioStore portfolioStore,
                       ProposalBuffer proposalBuffer,
                       TradeJournal tradeJournal,
                       AgentHealthRegistry healthRegistry,
                       MetricsService metricsService,
                       PipelineProperties pipelineProperties,
                       AgentProperties agentProperties,
                       Clock clock) {
        this.proposers = proposers;
        this.agentScheduler = agentScheduler;
        this.snapshotStore = snapshotStore;
        this.portfolioStore = portfolioStore;
        this.proposalBuffer = proposalBuffer;
        this.tradeJournal = tradeJournal;
        this.healthRegistry = healthRegistry;
        this.metricsService = metricsService;
        this.pipelineProperties = pipelineProperties;
        this.agentProperties = agentProperties;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        for (Proposer proposer : proposers) {
            if (!proposer.isEnabled()) {
                log.info("Agent {} disabled", proposer.name());
                continue;
            }
            healthRegistry.register(proposer.name(), proposer.cadence());
            scheduled.add(agentScheduler.scheduleAtFixedRate(() -> tick(proposer), proposer.cadence()));
            log.info("Agent {} scheduled every {}s", proposer.name(), proposer.cadence().toSeconds());
        }
    }

    @PreDestroy
    public void stop() {
        scheduled.forEach(future -> future.cancel(false));
        scheduled.clear();
    }

    /**
     * One pass of an agent over every configured instrument.
     *
     * @return number of proposals accepted by the buffer
     */
    public int tick(Proposer proposer) {
        try {
            Duration maxAge = Duration.ofSeconds(agentProperties.getMaxSnapshotAgeSeconds());
            PortfolioSnapshot portfolio = portfolioStore.snapshot();
            int accepted = 0;
            for (String instrument : pipelineProperties.getInstruments()) {
                Optional<MarketSnapshot> snapshot = snapshotStore.fresh(instrument, maxAge);
                if (snapshot.isEmpty()) {
                    log.debug("Agent {} skipping {}: no fresh snapshot", proposer.name(), instrument);
                    continue;
                }
                Optional<Proposal> proposal = proposer.propose(snapshot.get(), portfolio);
                if (proposal.isEmpty()) {
                    continue;
                }
                if (!proposalBuffer.offer(proposal.get())) {
                    log.warn("Proposal buffer full, dropping proposal agent={} instrument={}",
                            proposer.name(), instrument);
                    continue;
                }
                accepted++;
                metricsService.recordProposal(proposer.name());
                tradeJournal.recordProposal(proposal.get());
            }
            healthRegistry.recordSuccess(proposer.name(), clock.instant(), accepted);
            return accepted;
        } catch (RuntimeException e) {
            log.error("Agent {} tick failed", proposer.name(), e);
            healthRegistry.recordFailure(proposer.name(), clock.instant(), e.getMessage());
            return 0;
        }
    }
}

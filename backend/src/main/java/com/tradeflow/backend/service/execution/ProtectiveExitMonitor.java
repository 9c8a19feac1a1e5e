package com.tradeflow.backend.service.execution;

import com.tradeflow.backend.config.AgentProperties;
import com.tradeflow.backend.model.MarketSnapshot;
import com.tradeflow.backend.model.OrderPurpose;
import com.tradeflow.backend.model.Position;
import com.tradeflow.backend.service.ScheduledTaskGuard;
import com.tradeflow.backend.service.marketdata.MarketSnapshotStore;
import com.tradeflow.backend.service.portfolio.PortfolioStore;
import com.tradeflow.backend.trading.pipeline.ApprovedOrder;
import com.tradeflow.backend.trading.pipeline.PriceConstraint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Watches open positions against their stop-loss and take-profit levels and sends a
 * closing market order through the execution coordinator when one is crossed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "execution.protective-exit.enabled", havingValue = "true", matchIfMissing = true)
public class ProtectiveExitMonitor {

    private final PortfolioStore portfolioStore;
    private final MarketSnapshotStore snapshotStore;
    private final ExecutionCoordinator executionCoordinator;
    private final AgentProperties agentProperties;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${execution.protective-exit.interval-ms:5000}")
    public void monitor() {
        scheduledTaskGuard.run("protective-exit", this::checkPositions);
    }

    public List<OrderHandle> checkPositions() {
        List<OrderHandle> submitted = new ArrayList<>();
        Duration maxAge = Duration.ofSeconds(agentProperties.getMaxSnapshotAgeSeconds());
        for (Position position : portfolioStore.snapshot().openPositions().values()) {
            if (executionCoordinator.isInFlight(position.instrument())) {
                continue;
            }
            Optional<MarketSnapshot> snapshot = snapshotStore.fresh(position.instrument(), maxAge);
            if (snapshot.isEmpty()) {
                log.debug("No fresh price for open position {}, exit check skipped", position.instrument());
                continue;
            }
            String trigger = trigger(position, snapshot.get());
            if (trigger == null) {
                continue;
            }
            ApprovedOrder exit = ApprovedOrder.builder()
                    .orderId(UUID.randomUUID().toString())
                    .decisionReference(trigger + ":" + position.instrument())
                    .instrument(position.instrument())
                    .side(position.side().opposite())
                    .purpose(OrderPurpose.CLOSE)
                    .requestedQuantity(position.quantity())
                    .approvedQuantity(position.quantity())
                    .referencePrice(snapshot.get().price())
                    .venue(position.venue())
                    .priceConstraint(PriceConstraint.market())
                    .rationale(trigger + " at " + snapshot.get().price() + " for " + position.side()
                            + " entered at " + position.entryPrice())
                    .createdAt(clock.instant())
                    .build();
            log.info("{} triggered for {} {} qty={} price={}", trigger, position.side(), position.instrument(),
                    position.quantity(), snapshot.get().price());
            submitted.add(executionCoordinator.submit(exit));
        }
        return submitted;
    }

    private String trigger(Position position, MarketSnapshot snapshot) {
        if (position.stopLossBreached(snapshot.price())) {
            return "STOP_LOSS";
        }
        if (position.takeProfitReached(snapshot.price())) {
            return "TAKE_PROFIT";
        }
        return null;
    }
}

package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pipeline.scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class TradingCycleScheduler {

    private final TradingCycleService tradingCycleService;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedRateString = "${pipeline.cycle-interval-ms:30000}",
            initialDelayString = "${pipeline.cycle-interval-ms:30000}")
    public void runCycle() {
        scheduledTaskGuard.run("trading-cycle", tradingCycleService::runCycle);
    }
}

package com.tradeflow.backend.service.marketdata;

import com.tradeflow.backend.config.PipelineProperties;
import com.tradeflow.backend.exception.MarketDataUnavailableException;
import com.tradeflow.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class MarketSnapshotRefresher {

    private final MarketDataFeed marketDataFeed;
    private final MarketSnapshotStore snapshotStore;
    private final PipelineProperties pipelineProperties;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${market-data.poll-interval-ms:5000}")
    public void refresh() {
        scheduledTaskGuard.run("market-data-refresh", this::refreshAll);
    }

    void refreshAll() {
        int updated = 0;
        for (String instrument : pipelineProperties.getInstruments()) {
            try {
                snapshotStore.update(marketDataFeed.getSnapshot(instrument));
                updated++;
            } catch (MarketDataUnavailableException e) {
                // previous snapshot stays and ages out
                log.warn("Market data unavailable instrument={} reason={}", instrument, e.getMessage());
            }
        }
        log.debug("Market data refreshed {}/{} instruments", updated, pipelineProperties.getInstruments().size());
    }
}

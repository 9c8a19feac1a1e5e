package com.tradeflow.backend.service.marketdata;

import com.tradeflow.backend.model.MarketSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest observation per instrument. Readers never block writers.
 */
@Service
@RequiredArgsConstructor
public class MarketSnapshotStore {

    private final Clock clock;
    private final Map<String, MarketSnapshot> latest = new ConcurrentHashMap<>();

    public void update(MarketSnapshot snapshot) {
        // an out-of-order observation never replaces a newer one
        latest.merge(snapshot.instrument(), snapshot,
                (current, incoming) -> incoming.observedAt().isBefore(current.observedAt()) ? current : incoming);
    }

    public Optional<MarketSnapshot> latest(String instrument) {
        return Optional.ofNullable(latest.get(instrument));
    }

    public Optional<MarketSnapshot> fresh(String instrument, Duration maxAge) {
        return latest(instrument).filter(snapshot -> !snapshot.isStale(clock.instant(), maxAge));
    }
}

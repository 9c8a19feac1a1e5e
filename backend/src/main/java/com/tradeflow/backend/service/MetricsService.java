package com.tradeflow.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, AtomicLong> rejectsByReason = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> ordersByState = new ConcurrentHashMap<>();

    public void recordProposal(String agent) {
        Counter.builder("agent_proposals_total")
                .tag("agent", agent)
                .register(meterRegistry)
                .increment();
    }

    public void recordCycle(int proposals, int decisions) {
        Counter.builder("cycle_proposals_total").register(meterRegistry).increment(proposals);
        Counter.builder("cycle_decisions_total").register(meterRegistry).increment(decisions);
    }

    public void recordReject(String reason) {
        rejectsByReason.computeIfAbsent(reason, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("decisions_rejected_total")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordOrderTerminal(String state) {
        ordersByState.computeIfAbsent(state, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("orders_terminal_total")
                .tag("state", state)
                .register(meterRegistry)
                .increment();
    }

    public void recordVenueRetry(String venue) {
        Counter.builder("venue_retries_total")
                .tag("venue", venue)
                .register(meterRegistry)
                .increment();
    }

    public void recordInvariantViolation(String invariant) {
        Counter.builder("invariant_violations_total")
                .tag("invariant", invariant)
                .register(meterRegistry)
                .increment();
    }

    public Map<String, Long> rejectCounts() {
        return rejectsByReason.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get()));
    }

    public Map<String, Long> terminalOrderCounts() {
        return ordersByState.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get()));
    }
}

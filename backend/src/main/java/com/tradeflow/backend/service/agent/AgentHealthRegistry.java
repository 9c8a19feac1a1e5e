package com.tradeflow.backend.service.agent;

import com.tradeflow.backend.model.AgentHealth;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class AgentHealthRegistry {

    private final Map<String, AgentHealth> health = new ConcurrentHashMap<>();

    public void register(String agent, Duration cadence) {
        health.putIfAbsent(agent, new AgentHealth(agent, cadence, null, null, null, 0));
    }

    public void recordSuccess(String agent, Instant at, int proposals) {
        health.computeIfPresent(agent, (key, current) -> new AgentHealth(
                key, current.cadence(), at, current.lastFailure(), current.lastError(),
                current.proposalsEmitted() + proposals));
    }

    public void recordFailure(String agent, Instant at, String error) {
        health.computeIfPresent(agent, (key, current) -> new AgentHealth(
                key, current.cadence(), current.lastSuccessfulCycle(), at, error, current.proposalsEmitted()));
    }

    public List<AgentHealth> snapshot() {
        return health.values().stream()
                .sorted(Comparator.comparing(AgentHealth::agent))
                .toList();
    }
}

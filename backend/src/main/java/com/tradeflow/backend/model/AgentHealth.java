package com.tradeflow.backend.model;

import java.time.Duration;
import java.time.Instant;

public record AgentHealth(
        String agent,
        Duration cadence,
        Instant lastSuccessfulCycle,
        Instant lastFailure,
        String lastError,
        long proposalsEmitted
) {}

package com.tradeflow.backend.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class VenueResilienceConfig {

    /**
     * Delay before retry n (1-based): base * 2^(n-1), jittered, capped at max delay.
     */
    @Bean
    public IntervalFunction venueBackoff(ExecutionProperties executionProperties) {
        return backoff(executionProperties.getRetry());
    }

    @Bean
    public TimeLimiter venueTimeLimiter(ExecutionProperties executionProperties) {
        return timeLimiter(executionProperties.getVenueTimeoutMs());
    }

    public static IntervalFunction backoff(ExecutionProperties.Retry retry) {
        Duration base = Duration.ofMillis(retry.getBaseDelayMs());
        Duration cap = Duration.ofMillis(Math.max(retry.getMaxDelayMs(), retry.getBaseDelayMs()));
        if (retry.getJitterFactor() <= 0.0) {
            return IntervalFunction.ofExponentialBackoff(base, 2.0, cap);
        }
        return IntervalFunction.ofExponentialRandomBackoff(base, 2.0, retry.getJitterFactor(), cap);
    }

    public static TimeLimiter timeLimiter(long timeoutMs) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("venue", config);
    }
}

package com.tradeflow.backend.service;

import com.tradeflow.backend.model.TradingNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Operator-visible escalation for conditions that indicate a bug rather than an
 * expected runtime outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    private final NotificationSink notificationSink;
    private final MetricsService metricsService;
    private final Clock clock;

    public void invariantViolated(String invariant, String instrument, String reference, String message) {
        log.error("INVARIANT VIOLATION invariant={} instrument={} ref={} message={}",
                invariant, instrument, reference, message);
        metricsService.recordInvariantViolation(invariant);
        notificationSink.publish(new TradingNotification(
                TradingNotification.Type.ALERT, instrument, reference, invariant, message, clock.instant()));
    }

    public void sendAlert(String type, String message) {
        log.error("ALERT type={} message={}", type, message);
        notificationSink.publish(new TradingNotification(
                TradingNotification.Type.ALERT, null, null, type, message, clock.instant()));
    }
}

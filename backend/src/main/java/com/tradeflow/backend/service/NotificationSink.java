package com.tradeflow.backend.service;

import com.tradeflow.backend.model.TradingNotification;

/**
 * Best-effort delivery of terminal outcomes, rejections and alerts.
 * Implementations must never throw into the caller.
 */
public interface NotificationSink {

    void publish(TradingNotification notification);
}

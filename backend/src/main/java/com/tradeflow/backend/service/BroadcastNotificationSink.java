package com.tradeflow.backend.service;

import com.tradeflow.backend.model.TradingNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastNotificationSink implements NotificationSink {

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void publish(TradingNotification notification) {
        try {
            messagingTemplate.convertAndSend(destination(notification.type()), notification);
        } catch (RuntimeException e) {
            log.warn("Notification delivery failed type={} ref={} error={}",
                    notification.type(), notification.reference(), e.getMessage());
        }
    }

    private String destination(TradingNotification.Type type) {
        return switch (type) {
            case EXECUTION -> "/topic/executions";
            case REJECTION -> "/topic/rejections";
            case ALERT -> "/topic/alerts";
        };
    }
}

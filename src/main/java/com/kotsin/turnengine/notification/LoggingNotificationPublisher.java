package com.kotsin.turnengine.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes notifications to the log. Hosts that display them replace this bean.
 */
@Slf4j
@Component
public class LoggingNotificationPublisher implements NotificationPublisher {

    @Override
    public void publish(TurnNotification notification) {
        log.info("[{}] {} {}", notification.getCharacterId(), notification.getCode(), notification.getParams());
    }
}

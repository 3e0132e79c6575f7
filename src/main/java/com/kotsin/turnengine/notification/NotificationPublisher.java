package com.kotsin.turnengine.notification;

/**
 * Host hook for turn notifications.
 */
public interface NotificationPublisher {
    void publish(TurnNotification notification);
}

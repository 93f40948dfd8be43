package com.leadflow.backend.services.notification;

/**
 * Narrow contract to the owner messaging channel.
 */
public interface NotificationPort {

    /**
     * @return true when the message was accepted by the channel
     */
    boolean notify(String recipient, String title, String content);
}

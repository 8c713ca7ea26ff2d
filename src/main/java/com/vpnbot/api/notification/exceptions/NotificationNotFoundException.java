package com.vpnbot.api.notification.exceptions;

/**
 * Thrown by markRead operation in NotificationService.
 */
public class NotificationNotFoundException extends Exception {

    public NotificationNotFoundException(String message) {
        super(message);
    }
}

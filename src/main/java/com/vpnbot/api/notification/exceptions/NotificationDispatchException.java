package com.vpnbot.api.notification.exceptions;

/**
 * Thrown by notify operation in NotificationDispatcher.
 */
public class NotificationDispatchException extends Exception {

    public NotificationDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}

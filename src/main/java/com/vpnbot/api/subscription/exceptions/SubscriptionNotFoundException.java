package com.vpnbot.api.subscription.exceptions;

/**
 * Thrown by getCurrentSubscription operation in SubscriptionService.
 */
public class SubscriptionNotFoundException extends Exception {

    public SubscriptionNotFoundException(String message) {
        super(message);
    }
}

package com.vpnbot.api.subscription.exceptions;

/**
 * Thrown by grantAccess and quotePlan operations in SubscriptionService.
 */
public class PlanNotFoundException extends Exception {

    public PlanNotFoundException(String message) {
        super(message);
    }
}

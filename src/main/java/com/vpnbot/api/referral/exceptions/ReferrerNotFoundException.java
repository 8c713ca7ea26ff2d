package com.vpnbot.api.referral.exceptions;

/**
 * Thrown by getOrCreateLink and getStats operations in ReferralService when the user isn't
 * registered.
 */
public class ReferrerNotFoundException extends Exception {

    public ReferrerNotFoundException(String message) {
        super(message);
    }
}

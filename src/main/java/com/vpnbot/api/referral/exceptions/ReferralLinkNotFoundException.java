package com.vpnbot.api.referral.exceptions;

/**
 * Thrown by setLinkActive operation in ReferralService.
 */
public class ReferralLinkNotFoundException extends Exception {

    public ReferralLinkNotFoundException(String message) {
        super(message);
    }
}

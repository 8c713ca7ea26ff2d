package com.vpnbot.api.vpn.exceptions;

/**
 * Thrown by reconcileNow operation in VpnService.
 */
public class UnknownUserException extends Exception {

    public UnknownUserException(String message) {
        super(message);
    }
}

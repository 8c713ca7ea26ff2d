package com.vpnbot.api.vpn.exceptions;

/**
 * Thrown when the ledger contradicts one of its own invariants, e.g. a user with more than one
 * active VPN connection. It is never repaired automatically.
 */
public class ConsistencyViolationException extends RuntimeException {

    public ConsistencyViolationException(String message) {
        super(message);
    }
}

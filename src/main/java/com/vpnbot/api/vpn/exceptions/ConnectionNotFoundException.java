package com.vpnbot.api.vpn.exceptions;

/**
 * Thrown by getConnection operation in VpnService.
 */
public class ConnectionNotFoundException extends Exception {

    public ConnectionNotFoundException(String message) {
        super(message);
    }
}

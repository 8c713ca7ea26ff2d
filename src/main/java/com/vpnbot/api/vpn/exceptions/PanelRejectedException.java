package com.vpnbot.api.vpn.exceptions;

/**
 * Thrown by VpnProvisioner when the panel refuses a request outright, e.g. a malformed username or
 * invalid credentials. Repeating the request won't help.
 */
public class PanelRejectedException extends PanelException {

    public PanelRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.vpnbot.api.vpn.exceptions;

/**
 * Thrown by VpnProvisioner when the panel has no account with the requested username.
 */
public class PanelAccountNotFoundException extends PanelException {

    public PanelAccountNotFoundException(String message) {
        super(message);
    }
}

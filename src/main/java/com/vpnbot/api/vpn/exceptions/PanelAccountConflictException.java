package com.vpnbot.api.vpn.exceptions;

/**
 * Thrown by createAccount operation in VpnProvisioner when the username is already taken.
 */
public class PanelAccountConflictException extends PanelException {

    public PanelAccountConflictException(String message) {
        super(message);
    }
}

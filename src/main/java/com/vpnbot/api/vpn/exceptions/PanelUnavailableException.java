package com.vpnbot.api.vpn.exceptions;

/**
 * Thrown by VpnProvisioner when the panel can't be reached, times out or fails internally. The
 * same request may succeed later.
 */
public class PanelUnavailableException extends PanelException {

    public PanelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.vpnbot.api.vpn.exceptions;

/**
 * Base of the errors reported by a {@link com.vpnbot.api.vpn.upstream.VpnProvisioner}.
 */
public abstract class PanelException extends Exception {

    protected PanelException(String message) {
        super(message);
    }

    protected PanelException(String message, Throwable cause) {
        super(message, cause);
    }
}

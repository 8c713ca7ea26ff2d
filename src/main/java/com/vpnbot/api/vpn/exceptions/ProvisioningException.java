package com.vpnbot.api.vpn.exceptions;

/**
 * Base of the errors thrown by enable, disable and reconcile operations in VpnService.
 */
public abstract class ProvisioningException extends Exception {

    protected ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}

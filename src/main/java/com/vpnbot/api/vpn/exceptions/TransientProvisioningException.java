package com.vpnbot.api.vpn.exceptions;

/**
 * Thrown by VpnService when the panel is temporarily unavailable. The ledger is left untouched and
 * the operation is safe to retry.
 */
public class TransientProvisioningException extends ProvisioningException {

    public TransientProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}

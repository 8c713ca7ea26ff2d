package com.vpnbot.api.vpn.exceptions;

/**
 * Thrown by VpnService when the panel rejects a request or a username can't be allocated. Retrying
 * won't help; an operator must intervene.
 */
public class PermanentProvisioningException extends ProvisioningException {

    public PermanentProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}

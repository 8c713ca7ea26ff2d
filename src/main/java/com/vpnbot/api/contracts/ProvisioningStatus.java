package com.vpnbot.api.contracts;

/**
 * Outcome of bringing a user's VPN panel account in line with their subscription.
 */
public enum ProvisioningStatus {

    /**
     * The panel account matches the ledger.
     */
    PROVISIONED,

    /**
     * The panel was unreachable. A retry is scheduled.
     */
    DEFERRED,

    /**
     * The panel rejected the request or retries were exhausted. An operator must intervene.
     */
    FAILED,
}

package com.vpnbot.api.contracts;

import lombok.NonNull;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

/**
 * Defines a service contract for vpn service to provide provisioning operations to the payment,
 * user and subscription services.
 */
public interface VpnServiceContract {

    /**
     * <p>
     * Reconciles the user's panel account with their subscription state. It never throws on panel
     * failures; instead, it records the failure for a later retry (transient failures) or escalates
     * it (permanent failures).</p>
     *
     * <p>It must be invoked after the ledger transaction that changed the subscription commits.</p>
     *
     * @param userId id of the user.
     * @return the provisioning outcome.
     */
    @NonNull
    ProvisioningStatus provision(long userId);

    /**
     * @param now current time.
     * @param limit maximum number of ids to return.
     * @return ids of users whose failed provisioning is due for a retry at {@code now}.
     */
    @NonNull
    List<Long> findUsersDueForRetry(@NonNull OffsetDateTime now, int limit);

    /**
     * @return ids of users that have an active VPN connection.
     */
    @NonNull
    Set<Long> findUsersWithActiveConnection();

    /**
     * @return ids of users with a recorded provisioning failure, retryable or permanent.
     */
    @NonNull
    Set<Long> findUsersWithProvisioningFailure();
}

package com.vpnbot.api.vpn.upstream;

import com.vpnbot.api.vpn.exceptions.PanelAccountConflictException;
import com.vpnbot.api.vpn.exceptions.PanelAccountNotFoundException;
import com.vpnbot.api.vpn.exceptions.PanelRejectedException;
import com.vpnbot.api.vpn.exceptions.PanelUnavailableException;
import lombok.NonNull;

/**
 * Manages accounts on the external VPN panel. The panel isn't transactional; every call takes
 * effect immediately or fails as a whole.
 */
public interface VpnProvisioner {

    /**
     * Creates an enabled account.
     *
     * @throws PanelAccountConflictException if the username is already taken.
     * @throws PanelUnavailableException     on network errors, timeouts or panel errors.
     * @throws PanelRejectedException        if the panel refuses the request.
     */
    void createAccount(@NonNull String username)
        throws PanelAccountConflictException, PanelUnavailableException, PanelRejectedException;

    /**
     * Enables or disables an existing account.
     *
     * @throws PanelAccountNotFoundException if the account doesn't exist.
     * @throws PanelUnavailableException     on network errors, timeouts or panel errors.
     * @throws PanelRejectedException        if the panel refuses the request.
     */
    void setEnabled(@NonNull String username, boolean enabled)
        throws PanelAccountNotFoundException, PanelUnavailableException, PanelRejectedException;

    /**
     * Deletes an account. Deleting an account that doesn't exist succeeds.
     *
     * @throws PanelUnavailableException on network errors, timeouts or panel errors.
     * @throws PanelRejectedException    if the panel refuses the request.
     */
    void deleteAccount(@NonNull String username) throws PanelUnavailableException, PanelRejectedException;

    /**
     * @return {@code true} if the account is enabled.
     * @throws PanelAccountNotFoundException if the account doesn't exist.
     * @throws PanelUnavailableException     on network errors, timeouts or panel errors.
     * @throws PanelRejectedException        if the panel refuses the request.
     */
    boolean getStatus(@NonNull String username)
        throws PanelAccountNotFoundException, PanelUnavailableException, PanelRejectedException;
}

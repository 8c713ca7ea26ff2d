package com.vpnbot.api.contracts;

/**
 * Defines a service contract for the user ledger to provide lookups and per-user serialization to
 * the other services.
 */
public interface UserServiceContract {

    /**
     * @param userId platform id of a user.
     * @return {@code true} if the user has interacted with the bot before.
     */
    boolean isRegistered(long userId);

    /**
     * Acquires an exclusive lock on the user's ledger row for the rest of the caller's
     * transaction. Operations that hold it for the same user run one after another.
     *
     * @param userId platform id of a user.
     * @return {@code false} if the user doesn't exist.
     */
    boolean lockUser(long userId);
}

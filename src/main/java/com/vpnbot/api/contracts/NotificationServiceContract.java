package com.vpnbot.api.contracts;

import lombok.NonNull;

import java.util.Map;

/**
 * Defines a service contract for notification service to record and deliver user notifications on
 * behalf of the other services.
 */
public interface NotificationServiceContract {

    /**
     * Appends a notification to the user's history in the caller's ledger transaction. A
     * non-{@literal null} {@code reference} makes the record idempotent: at most one notification
     * of a {@code kind} exists per user and reference.
     *
     * @param userId    id of the recipient.
     * @param kind      kind of the notification.
     * @param reference an optional idempotency marker, e.g. {@code subscription:12:1700000000}.
     * @param payload   values rendered into the notification text.
     * @return {@code false} if a notification with the same reference was already recorded.
     */
    boolean record(long userId, @NonNull NotificationKind kind, String reference, @NonNull Map<String, Object> payload);

    /**
     * @return whether a notification of the given {@code kind} and {@code reference} exists.
     */
    boolean exists(long userId, @NonNull NotificationKind kind, @NonNull String reference);

    /**
     * Delivers a notification to the user without recording it. Delivery is best-effort: failures
     * are logged and never propagated.
     */
    void dispatch(long userId, @NonNull NotificationKind kind, @NonNull Map<String, Object> payload);

    /**
     * Records the notification in its own transaction and delivers it if the record was new.
     *
     * @return {@code true} if the notification was recorded.
     * @see #record(long, NotificationKind, String, Map)
     * @see #dispatch(long, NotificationKind, Map)
     */
    boolean notify(long userId, @NonNull NotificationKind kind, String reference, @NonNull Map<String, Object> payload);
}

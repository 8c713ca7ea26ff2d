package com.vpnbot.api.notification;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.notification.exceptions.NotificationDispatchException;
import lombok.NonNull;

import java.util.Map;

/**
 * Delivers notifications to users over an external channel.
 */
public interface NotificationDispatcher {

    /**
     * @param userId  platform id of the recipient.
     * @param kind    kind of the notification.
     * @param payload values rendered into the notification text.
     * @throws NotificationDispatchException if the channel didn't accept the notification.
     */
    void notify(long userId, @NonNull NotificationKind kind, @NonNull Map<String, Object> payload) throws NotificationDispatchException;
}

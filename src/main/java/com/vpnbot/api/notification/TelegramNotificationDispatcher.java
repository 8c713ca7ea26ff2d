package com.vpnbot.api.notification;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.notification.exceptions.NotificationDispatchException;
import com.vpnbot.api.notification.upstream.TelegramApi;
import lombok.NonNull;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Map;

/**
 * {@link NotificationDispatcher} that delivers notifications as Telegram chat messages.
 */
class TelegramNotificationDispatcher implements NotificationDispatcher {

    private final TelegramApi telegramApi;

    TelegramNotificationDispatcher(@NonNull TelegramApi telegramApi) {
        this.telegramApi = telegramApi;
    }

    @Override
    public void notify(long userId, @NonNull NotificationKind kind, @NonNull Map<String, Object> payload) throws NotificationDispatchException {
        try {
            telegramApi.sendMessage(userId, NotificationFormatter.chatText(kind, payload));
        } catch (TelegramApiException e) {
            throw new NotificationDispatchException("telegram api refused the message", e);
        }
    }
}

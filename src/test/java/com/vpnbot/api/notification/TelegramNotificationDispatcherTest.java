package com.vpnbot.api.notification;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.notification.exceptions.NotificationDispatchException;
import com.vpnbot.api.notification.upstream.TelegramApi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TelegramNotificationDispatcherTest {

    @Mock
    private TelegramApi telegramApi;

    private TelegramNotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new TelegramNotificationDispatcher(telegramApi);
    }

    @Test
    void notify_sendsChatText() throws Exception {
        dispatcher.notify(42L, NotificationKind.ACCESS_RESTORED, Map.of());
        verify(telegramApi).sendMessage(42L, NotificationFormatter.chatText(NotificationKind.ACCESS_RESTORED, Map.of()));
    }

    @Test
    void notify_withBlockedBot() throws TelegramApiException {
        doThrow(new TelegramApiException("Forbidden: bot was blocked by the user"))
            .when(telegramApi).sendMessage(anyLong(), anyString());

        assertThrows(
            NotificationDispatchException.class,
            () -> dispatcher.notify(42L, NotificationKind.SUBSCRIPTION_EXPIRED, Map.of()));
    }
}

package com.vpnbot.api.notification;

import com.vpnbot.api.notification.upstream.TelegramApi;
import lombok.NonNull;
import lombok.val;
import org.apache.http.client.config.RequestConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.bots.DefaultBotOptions;

/**
 * Spring Beans used by the notification package.
 */
@Configuration
class NotificationBeans {

    @NonNull
    @Bean
    TelegramApi telegramApi(@NonNull NotificationConfiguration config) {
        val timeout = (int) config.getRequestTimeout().toMillis();
        val options = new DefaultBotOptions();
        options.setRequestConfig(
            RequestConfig.custom()
                .setConnectTimeout(timeout)
                .setConnectionRequestTimeout(timeout)
                .setSocketTimeout(timeout)
                .build());

        return new TelegramApi(options, config.getTelegramBotToken());
    }

    @NonNull
    @Bean
    NotificationDispatcher notificationDispatcher(@NonNull TelegramApi telegramApi) {
        return new TelegramNotificationDispatcher(telegramApi);
    }
}

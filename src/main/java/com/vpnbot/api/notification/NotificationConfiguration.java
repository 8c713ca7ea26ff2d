package com.vpnbot.api.notification;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties used by various components in the notification package.
 */
@Validated
@ConfigurationProperties("app.notifications")
@Data
class NotificationConfiguration {

    @NotBlank
    private final String telegramBotToken;

    /**
     * Bounds connecting to and waiting for the Telegram Bot API.
     */
    @NotNull
    private final Duration requestTimeout;
}

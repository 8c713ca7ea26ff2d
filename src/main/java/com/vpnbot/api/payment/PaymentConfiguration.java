package com.vpnbot.api.payment;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties used by various components in the payment package.
 */
@Validated
@ConfigurationProperties("app.payments")
@Data
class PaymentConfiguration {

    /**
     * Shared secret the payment provider sends in the {@code X-Webhook-Secret} header.
     */
    @NotBlank
    private final String webhookSecret;
}

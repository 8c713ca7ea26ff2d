package com.vpnbot.api.vpn;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties used by various components in the vpn package.
 */
@Validated
@ConfigurationProperties("app.vpn")
@Data
class VpnConfiguration {

    /**
     * Root url of the Marzban panel, e.g. {@code https://panel.example.com}.
     */
    @NotBlank
    private final String panelUrl;

    @NotBlank
    private final String panelUsername;

    @NotBlank
    private final String panelPassword;

    /**
     * Secret key for deriving panel usernames from user ids.
     */
    @NotBlank
    private final String usernameSecret;

    /**
     * Proxy protocols enabled on new panel accounts.
     */
    @NotEmpty
    private final List<String> protocols;

    /**
     * How many usernames to try before giving up when the panel reports a conflict.
     */
    @Min(1)
    private final int maxUsernameAttempts;

    /**
     * Connect and read timeout of the panel requests.
     */
    @NotNull
    private final Duration requestTimeout;

    /**
     * Number of failed attempts after which a provisioning failure stops being retried.
     */
    @Min(1)
    private final int maxProvisioningAttempts;

    /**
     * Delay before the first retry. It doubles with every failed attempt.
     */
    @NotNull
    private final Duration retryBackoff;

    @NotNull
    private final Duration retryBackoffMax;
}

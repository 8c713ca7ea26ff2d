package com.vpnbot.api.subscription;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties used by various components in the subscription package.
 */
@Validated
@ConfigurationProperties("app.subscriptions")
@Data
class SubscriptionConfiguration {

    /**
     * How a purchase extends an access window that hasn't expired yet.
     */
    @NotNull
    private final RenewalPolicy renewalPolicy;

    /**
     * How long before the end of a subscription its owner is warned.
     */
    @NotNull
    private final Duration expiryWarningWindow;

    /**
     * Delay between the end of a sweep and the start of the next one.
     */
    @NotNull
    private final Duration sweepInterval;

    /**
     * Maximum number of items a single sweep step processes.
     */
    @Min(1)
    private final int sweepBatchSize;

    enum RenewalPolicy {

        /**
         * New days are appended to the end of the current window.
         */
        STACK,

        /**
         * The current window is replaced by one that starts now.
         */
        RESET,
    }
}

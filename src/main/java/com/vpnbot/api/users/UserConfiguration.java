package com.vpnbot.api.users;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties used by various components in the users package.
 */
@Validated
@ConfigurationProperties("app.users")
@Data
class UserConfiguration {

    /**
     * Number of days of access granted by the one-time trial.
     */
    @Min(1)
    private final int trialDays;
}

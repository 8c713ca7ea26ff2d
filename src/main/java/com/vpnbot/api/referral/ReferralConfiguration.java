package com.vpnbot.api.referral;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties used by various components in the referral package.
 */
@Validated
@ConfigurationProperties("app.referrals")
@Data
class ReferralConfiguration {

    /**
     * Days of access a referrer receives when a referee completes their first payment.
     */
    @Min(1)
    private final int bonusDays;

    /**
     * Prefix of referral links; the code of a link is appended to it, e.g.
     * {@code https://t.me/vpn_bot?start=}.
     */
    @NotBlank
    private final String linkBase;

    @Min(6)
    @Max(32)
    private final int codeLength;
}

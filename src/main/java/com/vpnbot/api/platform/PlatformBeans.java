package com.vpnbot.api.platform;

import lombok.NonNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring Beans shared by all packages.
 */
@Configuration
class PlatformBeans {

    /**
     * The single source of "now" for ledger timestamps and expiry checks. Tests replace it with a
     * {@link Clock#fixed(java.time.Instant, java.time.ZoneId) fixed clock}.
     */
    @NonNull
    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }
}

package com.vpnbot.api.vpn;

import com.vpnbot.api.vpn.upstream.MarzbanApi;
import com.vpnbot.api.vpn.upstream.VpnProvisioner;
import lombok.NonNull;
import lombok.val;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Beans used by the vpn package.
 */
@Configuration
class VpnBeans {

    @NonNull
    @Bean
    VpnProvisioner vpnProvisioner(@NonNull VpnConfiguration config, @NonNull RestTemplateBuilder restTemplateBuilder) {
        val restTemplate = restTemplateBuilder
            .rootUri(config.getPanelUrl())
            .setConnectTimeout(config.getRequestTimeout())
            .setReadTimeout(config.getRequestTimeout())
            .build();

        return new MarzbanApi(restTemplate, config.getPanelUsername(), config.getPanelPassword(), config.getProtocols());
    }

    @NonNull
    @Bean
    PanelUsernameGenerator panelUsernameGenerator(@NonNull VpnConfiguration config) {
        return new PanelUsernameGenerator(config.getUsernameSecret());
    }
}

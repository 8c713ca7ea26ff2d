package com.vpnbot.api.subscription;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Collection of scheduled tasks for the subscription package.
 */
@Component
@Slf4j
class SubscriptionScheduledTasks {

    private final ExpirySweeper expirySweeper;

    @Autowired
    SubscriptionScheduledTasks(@NonNull ExpirySweeper expirySweeper) {
        this.expirySweeper = expirySweeper;
    }

    @Scheduled(
        initialDelayString = "${app.subscriptions.sweep-initial-delay:PT1M}",
        fixedDelayString = "${app.subscriptions.sweep-interval}")
    void sweepExpiredSubscriptions() {
        log.info("sweeping expired subscriptions");
        expirySweeper.sweep();
    }
}

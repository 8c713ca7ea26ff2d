package com.vpnbot.api.subscription;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.contracts.NotificationServiceContract;
import com.vpnbot.api.contracts.ProvisioningStatus;
import com.vpnbot.api.contracts.VpnServiceContract;
import com.vpnbot.api.platform.transaction.UnitOfWork;
import com.vpnbot.api.subscription.entities.Subscription;
import com.vpnbot.api.subscription.entities.SubscriptionRepository;
import jakarta.annotation.PreDestroy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <p>
 * Periodically brings the ledger, the VPN panel and the users' notification history in line with
 * the passage of time. A sweep runs four independent steps, in order:</p>
 *
 * <ol>
 *     <li>deactivates subscriptions that have ended, reconciles their owners' VPN access and tells
 *     the owners whose access lapsed;</li>
 *     <li>warns owners whose current subscription ends within the warning window;</li>
 *     <li>retries provisioning that previously failed with a transient error;</li>
 *     <li>reconciles users whose VPN connection disagrees with their subscription, e.g. after a
 *     crash between a ledger commit and the following panel call.</li>
 * </ol>
 *
 * <p>
 * Every item is processed on its own, so a failing item never aborts the rest of the sweep. All
 * notifications carry a reference derived from the subscription and its {@code endAt}, which
 * makes re-running a sweep harmless.</p>
 *
 * <p>
 * Only one sweep runs at a time within this process. Running more than one instance of the
 * application needs an external lock around {@link #sweep()}.</p>
 */
@Component
@Slf4j
class ExpirySweeper {

    private final SubscriptionConfiguration subscriptionConfig;
    private final SubscriptionRepository subscriptionRepository;
    private final VpnServiceContract vpnServiceContract;
    private final NotificationServiceContract notificationServiceContract;
    private final UnitOfWork unitOfWork;
    private final Clock clock;
    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private volatile boolean isStopping = false;

    @Autowired
    ExpirySweeper(
        @NonNull SubscriptionConfiguration subscriptionConfig,
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull VpnServiceContract vpnServiceContract,
        @NonNull NotificationServiceContract notificationServiceContract,
        @NonNull UnitOfWork unitOfWork,
        @NonNull Clock clock
    ) {
        this.subscriptionConfig = subscriptionConfig;
        this.subscriptionRepository = subscriptionRepository;
        this.vpnServiceContract = vpnServiceContract;
        this.notificationServiceContract = notificationServiceContract;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    /**
     * Runs a sweep unless another one is already in progress.
     *
     * @return a report of the sweep, or empty if it was skipped.
     */
    @NonNull
    Optional<Report> sweep() {
        if (!isRunning.compareAndSet(false, true)) {
            log.info("previous sweep is still running, skipping");
            return Optional.empty();
        }

        try {
            val now = OffsetDateTime.now(clock);
            val report = new Report();
            expireEnded(now, report);
            warnExpiring(now, report);
            retryFailedProvisioning(now, report);
            repairDrift(now, report);
            log.info("sweep finished: {}", report);
            return Optional.of(report);
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Stops the in-progress sweep after its current item.
     */
    @PreDestroy
    void stop() {
        isStopping = true;
    }

    private void expireEnded(@NonNull OffsetDateTime now, @NonNull Report report) {
        val ended = subscriptionRepository.findAllActiveEndedBefore(now, batch());
        for (val subscription : ended) {
            if (isStopping) {
                return;
            }

            try {
                if (expire(subscription.getId(), now)) {
                    report.expired++;
                }
            } catch (RuntimeException e) {
                report.failed++;
                log.error("failed to expire subscription {}", subscription.getId(), e);
            }
        }
    }

    private boolean expire(long subscriptionId, @NonNull OffsetDateTime now) {
        val expiry = unitOfWork.execute(() -> {
            val subscription = subscriptionRepository.findById(subscriptionId).orElse(null);
            // a concurrent sweep or renewal got here first.
            if (subscription == null || !subscription.isActive() || subscription.getEndAt().isAfter(now)) {
                return null;
            }

            subscription.setActive(false);
            subscription.setUpdatedAt(now);
            subscriptionRepository.save(subscription);

            val userId = subscription.getUserId();
            val hasLapsed = !subscriptionRepository.existsValidByUserId(userId, now);
            val payload = buildPayload(subscription);
            val shouldNotify = hasLapsed && notificationServiceContract.record(
                userId, NotificationKind.SUBSCRIPTION_EXPIRED, buildReference(subscription), payload);

            return new Expiry(userId, shouldNotify, payload);
        });

        if (expiry == null) {
            return false;
        }

        log.info("subscription {} of user {} has ended", subscriptionId, expiry.userId);
        try {
            vpnServiceContract.provision(expiry.userId);
        } finally {
            // the notification is already recorded and won't be sent on a later sweep.
            if (expiry.shouldNotify) {
                notificationServiceContract.dispatch(expiry.userId, NotificationKind.SUBSCRIPTION_EXPIRED, expiry.payload);
            }
        }

        return true;
    }

    private void warnExpiring(@NonNull OffsetDateTime now, @NonNull Report report) {
        val warnBefore = now.plus(subscriptionConfig.getExpiryWarningWindow());
        val ending = subscriptionRepository.findAllActiveEndingBetween(now, warnBefore, batch());
        for (val subscription : ending) {
            if (isStopping) {
                return;
            }

            try {
                val payload = buildPayload(subscription);
                final boolean isRecorded = unitOfWork.execute(() -> {
                    val current = subscriptionRepository.findCurrentByUserId(subscription.getUserId()).orElse(null);
                    // a later window supersedes this one.
                    if (current == null || current.getId() != subscription.getId()) {
                        return false;
                    }

                    return notificationServiceContract.record(
                        subscription.getUserId(), NotificationKind.SUBSCRIPTION_EXPIRING, buildReference(subscription), payload);
                });

                if (isRecorded) {
                    report.warned++;
                    notificationServiceContract.dispatch(subscription.getUserId(), NotificationKind.SUBSCRIPTION_EXPIRING, payload);
                }
            } catch (RuntimeException e) {
                report.failed++;
                log.error("failed to warn about expiring subscription {}", subscription.getId(), e);
            }
        }
    }

    private void retryFailedProvisioning(@NonNull OffsetDateTime now, @NonNull Report report) {
        for (val userId : vpnServiceContract.findUsersDueForRetry(now, subscriptionConfig.getSweepBatchSize())) {
            if (isStopping) {
                return;
            }

            report.retried++;
            provision(userId, report);
        }
    }

    private void repairDrift(@NonNull OffsetDateTime now, @NonNull Report report) {
        val entitled = new HashSet<>(subscriptionRepository.findAllUserIdsWithValidSubscription(now));
        val connected = vpnServiceContract.findUsersWithActiveConnection();
        val drifted = new HashSet<Long>();
        entitled.stream().filter(id -> !connected.contains(id)).forEach(drifted::add);
        connected.stream().filter(id -> !entitled.contains(id)).forEach(drifted::add);

        // the retry step owns users with a recorded failure.
        drifted.removeAll(vpnServiceContract.findUsersWithProvisioningFailure());
        drifted.stream()
            .sorted()
            .limit(subscriptionConfig.getSweepBatchSize())
            .forEachOrdered(userId -> {
                if (isStopping) {
                    return;
                }

                log.warn("vpn connection of user {} has drifted from their subscription", userId);
                report.repaired++;
                provision(userId, report);
            });
    }

    private void provision(long userId, @NonNull Report report) {
        try {
            if (vpnServiceContract.provision(userId) != ProvisioningStatus.PROVISIONED) {
                report.failed++;
            }
        } catch (RuntimeException e) {
            report.failed++;
            log.error("failed to provision vpn access for user {}", userId, e);
        }
    }

    @NonNull
    private PageRequest batch() {
        return PageRequest.of(0, subscriptionConfig.getSweepBatchSize());
    }

    @NonNull
    private static String buildReference(@NonNull Subscription subscription) {
        return String.format("subscription:%d:%d", subscription.getId(), subscription.getEndAt().toEpochSecond());
    }

    @NonNull
    private static Map<String, Object> buildPayload(@NonNull Subscription subscription) {
        return Map.of(
            "subscriptionId", subscription.getId(),
            "endAt", subscription.getEndAt());
    }

    @AllArgsConstructor
    private static class Expiry {
        final long userId;
        final boolean shouldNotify;
        final Map<String, Object> payload;
    }

    /**
     * Counts of the items each step acted on.
     */
    @Data
    @NoArgsConstructor
    static class Report {
        int expired;
        int warned;
        int retried;
        int repaired;
        int failed;
    }
}

package com.vpnbot.api.vpn;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.contracts.NotificationServiceContract;
import com.vpnbot.api.contracts.ProvisioningStatus;
import com.vpnbot.api.contracts.SubscriptionServiceContract;
import com.vpnbot.api.contracts.UserServiceContract;
import com.vpnbot.api.contracts.VpnServiceContract;
import com.vpnbot.api.platform.transaction.UnitOfWork;
import com.vpnbot.api.vpn.entities.ProvisioningFailure;
import com.vpnbot.api.vpn.entities.ProvisioningFailureRepository;
import com.vpnbot.api.vpn.entities.VpnConnection;
import com.vpnbot.api.vpn.entities.VpnConnectionRepository;
import com.vpnbot.api.vpn.exceptions.ConnectionNotFoundException;
import com.vpnbot.api.vpn.exceptions.ConsistencyViolationException;
import com.vpnbot.api.vpn.exceptions.PanelAccountConflictException;
import com.vpnbot.api.vpn.exceptions.PanelAccountNotFoundException;
import com.vpnbot.api.vpn.exceptions.PanelException;
import com.vpnbot.api.vpn.exceptions.PanelUnavailableException;
import com.vpnbot.api.vpn.exceptions.PermanentProvisioningException;
import com.vpnbot.api.vpn.exceptions.ProvisioningException;
import com.vpnbot.api.vpn.exceptions.TransientProvisioningException;
import com.vpnbot.api.vpn.exceptions.UnknownUserException;
import com.vpnbot.api.vpn.payload.ConnectionResponse;
import com.vpnbot.api.vpn.upstream.VpnProvisioner;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * <p>
 * {@link VpnService} keeps the users' panel accounts in line with their subscriptions. The ledger
 * row of a connection is written in the same transaction that makes the panel call, while holding
 * the owner's user lock, so two provisioning runs for one user never interleave.</p>
 *
 * <p>
 * The panel isn't transactional. When a ledger write fails after the panel accepted a new account,
 * the account is deleted again. When anything fails after a ledger commit, the failure is recorded
 * and the expiry sweeper retries it.</p>
 */
@Service
@Slf4j
class VpnService implements VpnServiceContract {

    private final VpnConfiguration vpnConfig;
    private final VpnConnectionRepository connectionRepository;
    private final ProvisioningFailureRepository failureRepository;
    private final VpnProvisioner vpnProvisioner;
    private final PanelUsernameGenerator usernameGenerator;
    private final UserServiceContract userServiceContract;
    private final SubscriptionServiceContract subscriptionServiceContract;
    private final NotificationServiceContract notificationServiceContract;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    @Autowired
    VpnService(
        @NonNull VpnConfiguration vpnConfig,
        @NonNull VpnConnectionRepository connectionRepository,
        @NonNull ProvisioningFailureRepository failureRepository,
        @NonNull VpnProvisioner vpnProvisioner,
        @NonNull PanelUsernameGenerator usernameGenerator,
        @NonNull UserServiceContract userServiceContract,
        @NonNull SubscriptionServiceContract subscriptionServiceContract,
        @NonNull NotificationServiceContract notificationServiceContract,
        @NonNull UnitOfWork unitOfWork,
        @NonNull Clock clock
    ) {
        this.vpnConfig = vpnConfig;
        this.connectionRepository = connectionRepository;
        this.failureRepository = failureRepository;
        this.vpnProvisioner = vpnProvisioner;
        this.usernameGenerator = usernameGenerator;
        this.userServiceContract = userServiceContract;
        this.subscriptionServiceContract = subscriptionServiceContract;
        this.notificationServiceContract = notificationServiceContract;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    @NonNull
    @Override
    public ProvisioningStatus provision(long userId) {
        final boolean isAccessDesired;
        try {
            isAccessDesired = reconcile(userId);
        } catch (TransientProvisioningException e) {
            log.warn("provisioning of user {} deferred", userId, e);
            return recordFailure(userId, e, false);
        } catch (DataAccessException e) {
            log.warn("provisioning of user {} deferred after a ledger error", userId, e);
            return recordFailure(userId, e, false);
        } catch (ProvisioningException | ConsistencyViolationException e) {
            log.error("provisioning of user {} failed", userId, e);
            return recordFailure(userId, e, true);
        } catch (RuntimeException e) {
            log.warn("provisioning of user {} deferred after an unexpected error", userId, e);
            return recordFailure(userId, e, false);
        }

        val cleared = unitOfWork.execute(() -> {
            val failure = failureRepository.findByUserId(userId);
            failure.ifPresent(failureRepository::delete);
            return failure.isPresent();
        });

        if (cleared) {
            log.info("provisioning of user {} recovered", userId);
            if (isAccessDesired) {
                notificationServiceContract.notify(
                    userId, NotificationKind.ACCESS_RESTORED, null, Map.of("userId", userId));
            }
        }

        return ProvisioningStatus.PROVISIONED;
    }

    @NonNull
    @Override
    public List<Long> findUsersDueForRetry(@NonNull OffsetDateTime now, int limit) {
        return failureRepository.findAllDueUserIds(now, PageRequest.of(0, limit));
    }

    @NonNull
    @Override
    public Set<Long> findUsersWithActiveConnection() {
        return new HashSet<>(connectionRepository.findAllActiveUserIds());
    }

    @NonNull
    @Override
    public Set<Long> findUsersWithProvisioningFailure() {
        return new HashSet<>(failureRepository.findAllUserIds());
    }

    /**
     * Same as {@link #provision(long)}, for users that may not exist.
     *
     * @throws UnknownUserException if the user isn't registered.
     */
    @NonNull
    ProvisioningStatus reconcileNow(long userId) throws UnknownUserException {
        if (!userServiceContract.isRegistered(userId)) {
            throw new UnknownUserException("user doesn't exist");
        }

        return provision(userId);
    }

    /**
     * @return the user's active connection, or their most recent one if none is active.
     * @throws ConnectionNotFoundException if the user has never had a connection.
     */
    @NonNull
    ConnectionResponse getConnection(long userId) throws ConnectionNotFoundException {
        val active = findActiveConnection(userId);
        val connection = active.isPresent() ? active : connectionRepository.findFirstByUserIdOrderByIdDesc(userId);
        if (connection.isEmpty()) {
            throw new ConnectionNotFoundException("user doesn't have a vpn connection");
        }

        val failure = failureRepository.findByUserId(userId);
        return ConnectionResponse.builder()
            .id(connection.get().getId())
            .panelUsername(connection.get().getPanelUsername())
            .name(connection.get().getName())
            .isActive(connection.get().isActive())
            .isProvisioningPending(failure.map(f -> !f.isPermanent()).orElse(false))
            .isProvisioningFailed(failure.map(ProvisioningFailure::isPermanent).orElse(false))
            .createdAt(connection.get().getCreatedAt())
            .build();
    }

    /**
     * Brings the user's panel account in line with their subscription. Running it twice for a
     * converged user makes no changes on the panel.
     *
     * @return whether the user is entitled to access.
     * @throws TransientProvisioningException if the panel is temporarily unavailable.
     * @throws PermanentProvisioningException if the panel rejects a request.
     */
    boolean reconcile(long userId) throws ProvisioningException {
        return unitOfWork.execute(() -> {
            lockUser(userId);
            val now = OffsetDateTime.now(clock);
            val isDesired = subscriptionServiceContract.hasValidSubscription(userId, now);
            val active = findActiveConnection(userId);
            if (isDesired && active.isEmpty()) {
                enable(userId, now);
            } else if (!isDesired && active.isPresent()) {
                disable(active.get(), now);
            } else if (active.isPresent()) {
                auditEnabled(active.get(), now);
            } else {
                auditDisabled(userId);
            }

            return isDesired;
        });
    }

    /**
     * Creates or re-enables the user's panel account. No-op if the user already has an active
     * connection.
     */
    void enable(long userId) throws ProvisioningException {
        unitOfWork.run(() -> {
            lockUser(userId);
            if (findActiveConnection(userId).isEmpty()) {
                enable(userId, OffsetDateTime.now(clock));
            }
        });
    }

    /**
     * Disables the user's panel account. No-op if the user doesn't have an active connection.
     */
    void disable(long userId) throws ProvisioningException {
        unitOfWork.run(() -> {
            lockUser(userId);
            val active = findActiveConnection(userId);
            if (active.isPresent()) {
                disable(active.get(), OffsetDateTime.now(clock));
            }
        });
    }

    private void enable(long userId, @NonNull OffsetDateTime now) throws ProvisioningException {
        val latest = connectionRepository.findFirstByUserIdOrderByIdDesc(userId);
        if (latest.isEmpty()) {
            createConnection(userId, now);
            return;
        }

        val connection = latest.get();
        try {
            vpnProvisioner.setEnabled(connection.getPanelUsername(), true);
        } catch (PanelAccountNotFoundException e) {
            log.warn("panel account {} is missing, creating it again", connection.getPanelUsername());
            recreateAccount(connection.getPanelUsername());
        } catch (PanelException e) {
            throw translate(e);
        }

        connection.setActive(true);
        connection.setUpdatedAt(now);
        connectionRepository.save(connection);
        log.info("enabled vpn connection {} of user {}", connection.getId(), userId);
    }

    private void createConnection(long userId, @NonNull OffsetDateTime now) throws ProvisioningException {
        for (int attempt = 1; attempt <= vpnConfig.getMaxUsernameAttempts(); attempt++) {
            val username = usernameGenerator.generate(userId, attempt);
            if (connectionRepository.findByPanelUsername(username).isPresent()) {
                continue;
            }

            try {
                vpnProvisioner.createAccount(username);
            } catch (PanelAccountConflictException e) {
                log.warn("panel username {} is taken, trying another one", username);
                continue;
            } catch (PanelException e) {
                throw translate(e);
            }

            final VpnConnection connection;
            try {
                connection = connectionRepository.saveAndFlush(
                    VpnConnection.builder()
                        .userId(userId)
                        .panelUsername(username)
                        .name("VPN " + userId)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
            } catch (DataAccessException e) {
                deleteOrphanedAccount(username);
                throw e;
            }

            log.info("created vpn connection {} of user {}", connection.getId(), userId);
            return;
        }

        throw new PermanentProvisioningException(String.format(
            "couldn't allocate a panel username for user %d in %d attempts", userId, vpnConfig.getMaxUsernameAttempts()), null);
    }

    private void recreateAccount(@NonNull String username) throws ProvisioningException {
        try {
            vpnProvisioner.createAccount(username);
        } catch (PanelAccountConflictException e) {
            throw new PermanentProvisioningException("panel reports account " + username + " as both missing and taken", e);
        } catch (PanelException e) {
            throw translate(e);
        }
    }

    private void deleteOrphanedAccount(@NonNull String username) {
        try {
            vpnProvisioner.deleteAccount(username);
            log.info("deleted panel account {} after a failed ledger write", username);
        } catch (PanelException e) {
            log.error("failed to delete orphaned panel account {}", username, e);
        }
    }

    private void disable(@NonNull VpnConnection connection, @NonNull OffsetDateTime now) throws ProvisioningException {
        try {
            vpnProvisioner.setEnabled(connection.getPanelUsername(), false);
        } catch (PanelAccountNotFoundException e) {
            log.warn("panel account {} is already gone", connection.getPanelUsername());
        } catch (PanelException e) {
            throw translate(e);
        }

        connection.setActive(false);
        connection.setUpdatedAt(now);
        connectionRepository.save(connection);
        log.info("disabled vpn connection {} of user {}", connection.getId(), connection.getUserId());
    }

    private void auditEnabled(@NonNull VpnConnection connection, @NonNull OffsetDateTime now) throws ProvisioningException {
        val username = connection.getPanelUsername();
        try {
            if (!vpnProvisioner.getStatus(username)) {
                log.warn("panel account {} is disabled while its connection is active, enabling it", username);
                vpnProvisioner.setEnabled(username, true);
            }
        } catch (PanelAccountNotFoundException e) {
            log.warn("panel account {} is missing while its connection is active, creating it again", username);
            recreateAccount(username);
        } catch (PanelException e) {
            throw translate(e);
        }
    }

    private void auditDisabled(long userId) throws ProvisioningException {
        val latest = connectionRepository.findFirstByUserIdOrderByIdDesc(userId);
        if (latest.isEmpty()) {
            return;
        }

        val username = latest.get().getPanelUsername();
        try {
            if (vpnProvisioner.getStatus(username)) {
                log.warn("panel account {} is enabled while its connection is inactive, disabling it", username);
                vpnProvisioner.setEnabled(username, false);
            }
        } catch (PanelAccountNotFoundException e) {
            log.debug("panel account {} doesn't exist", username);
        } catch (PanelException e) {
            throw translate(e);
        }
    }

    @NonNull
    private Optional<VpnConnection> findActiveConnection(long userId) {
        val active = connectionRepository.findAllActiveByUserId(userId);
        if (active.size() > 1) {
            throw new ConsistencyViolationException(String.format(
                "user %d has %d active vpn connections", userId, active.size()));
        }

        return active.stream().findFirst();
    }

    private void lockUser(long userId) {
        if (!userServiceContract.lockUser(userId)) {
            throw new IllegalArgumentException("user " + userId + " doesn't exist");
        }
    }

    @NonNull
    private ProvisioningStatus recordFailure(long userId, @NonNull Exception cause, boolean isPermanent) {
        val now = OffsetDateTime.now(clock);
        final ProvisioningFailure failure;
        try {
            failure = unitOfWork.execute(() -> {
                val f = failureRepository.findByUserId(userId)
                    .orElseGet(() -> ProvisioningFailure.builder()
                        .userId(userId)
                        .createdAt(now)
                        .nextAttemptAt(now)
                        .build());

                val wasPermanent = f.isPermanent();
                f.setAttempts(f.getAttempts() + 1);
                f.setLastError(truncate(cause.getMessage()));
                f.setNextAttemptAt(now.plus(backoff(f.getAttempts())));
                f.setPermanent(wasPermanent || isPermanent || f.getAttempts() >= vpnConfig.getMaxProvisioningAttempts());
                f.setUpdatedAt(now);
                val saved = failureRepository.save(f);
                return saved.isPermanent() && !wasPermanent ? saved : null;
            });
        } catch (RuntimeException e) {
            log.error("failed to record provisioning failure of user {}", userId, e);
            return isPermanent ? ProvisioningStatus.FAILED : ProvisioningStatus.DEFERRED;
        }

        if (failure != null) {
            log.error("provisioning of user {} gave up after {} attempts", userId, failure.getAttempts());
            notificationServiceContract.notify(
                userId, NotificationKind.PROVISIONING_FAILED, "failure:" + failure.getId(), Map.of("userId", userId));
            return ProvisioningStatus.FAILED;
        }

        return isPermanent ? ProvisioningStatus.FAILED : ProvisioningStatus.DEFERRED;
    }

    @NonNull
    private Duration backoff(int attempts) {
        val max = vpnConfig.getRetryBackoffMax();
        var delay = vpnConfig.getRetryBackoff();
        for (int i = 1; i < attempts && delay.compareTo(max) < 0; i++) {
            delay = delay.multipliedBy(2);
        }

        return delay.compareTo(max) < 0 ? delay : max;
    }

    @NonNull
    private static ProvisioningException translate(@NonNull PanelException e) {
        if (e instanceof PanelUnavailableException) {
            return new TransientProvisioningException("vpn panel is unavailable", e);
        }

        return new PermanentProvisioningException("vpn panel rejected the request", e);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 1024) {
            return message;
        }

        return message.substring(0, 1024);
    }
}

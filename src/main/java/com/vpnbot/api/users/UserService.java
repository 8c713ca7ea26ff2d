package com.vpnbot.api.users;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.contracts.NotificationServiceContract;
import com.vpnbot.api.contracts.ProvisioningStatus;
import com.vpnbot.api.contracts.ReferralServiceContract;
import com.vpnbot.api.contracts.SubscriptionServiceContract;
import com.vpnbot.api.contracts.VpnServiceContract;
import com.vpnbot.api.platform.transaction.UnitOfWork;
import com.vpnbot.api.users.entities.User;
import com.vpnbot.api.users.entities.UserRepository;
import com.vpnbot.api.users.exceptions.TrialAlreadyUsedException;
import com.vpnbot.api.users.exceptions.UserNotFoundException;
import com.vpnbot.api.users.payload.RegisterUserParams;
import com.vpnbot.api.users.payload.TrialResponse;
import com.vpnbot.api.users.payload.UserResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * {@link UserService} implements operations related to user registration and trials.
 */
@Service
@Slf4j
class UserService {

    private final UserConfiguration userConfig;
    private final UserRepository userRepository;
    private final ReferralServiceContract referralServiceContract;
    private final SubscriptionServiceContract subscriptionServiceContract;
    private final VpnServiceContract vpnServiceContract;
    private final NotificationServiceContract notificationServiceContract;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    @Autowired
    UserService(
        @NonNull UserConfiguration userConfig,
        @NonNull UserRepository userRepository,
        @NonNull ReferralServiceContract referralServiceContract,
        @NonNull SubscriptionServiceContract subscriptionServiceContract,
        @NonNull VpnServiceContract vpnServiceContract,
        @NonNull NotificationServiceContract notificationServiceContract,
        @NonNull UnitOfWork unitOfWork,
        @NonNull Clock clock
    ) {
        this.userConfig = userConfig;
        this.userRepository = userRepository;
        this.referralServiceContract = referralServiceContract;
        this.subscriptionServiceContract = subscriptionServiceContract;
        this.vpnServiceContract = vpnServiceContract;
        this.notificationServiceContract = notificationServiceContract;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    /**
     * <p>
     * Creates a user on their first interaction with the bot, or refreshes the display fields of an
     * existing user.</p>
     *
     * <p>
     * A referral code is only honoured when the user is created, so a user can never switch their
     * referrer. Unknown or inactive codes, and users following their own link, are ignored.</p>
     */
    @NonNull
    UserResponse register(@NonNull RegisterUserParams params) {
        return unitOfWork.execute(() -> {
            val now = OffsetDateTime.now(clock);
            val existing = userRepository.findById(params.getId());
            val user = existing.orElseGet(() -> User.builder()
                .id(params.getId())
                .createdAt(now)
                .build());

            user.setUsername(params.getUsername());
            user.setFirstName(params.getFirstName());
            user.setLastName(params.getLastName());
            user.setLanguageCode(params.getLanguageCode());
            user.setUpdatedAt(now);
            val saved = userRepository.save(user);

            if (existing.isEmpty()) {
                log.info("registered user {}", saved.getId());
                if (params.getReferralCode() != null && !params.getReferralCode().isBlank()) {
                    referralServiceContract.registerReferral(saved.getId(), params.getReferralCode());
                }
            }

            return buildUserResponse(saved);
        });
    }

    @NonNull
    UserResponse getUser(long userId) throws UserNotFoundException {
        return userRepository.findById(userId)
            .map(UserService::buildUserResponse)
            .orElseThrow(() -> new UserNotFoundException("user doesn't exist"));
    }

    /**
     * Grants the one-time trial to the user, and provisions their VPN account once the grant has
     * committed.
     *
     * @throws UserNotFoundException     if the user doesn't exist.
     * @throws TrialAlreadyUsedException if the user has used their trial before.
     */
    @NonNull
    TrialResponse activateTrial(long userId) throws UserNotFoundException, TrialAlreadyUsedException {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException("user doesn't exist");
        }

        final OffsetDateTime accessEndsAt = unitOfWork.execute(() -> {
            val user = userRepository.findWithLockById(userId)
                .orElseThrow(() -> new IllegalStateException("user disappeared during trial activation"));

            if (user.isHasTrial()) {
                throw new TrialAlreadyUsedException("user has already used their trial");
            }

            val now = OffsetDateTime.now(clock);
            user.setHasTrial(true);
            user.setUpdatedAt(now);
            userRepository.save(user);
            return subscriptionServiceContract.grantDays(userId, userConfig.getTrialDays(), now);
        });

        log.info("activated trial of user {} until {}", userId, accessEndsAt);
        val provisioning = vpnServiceContract.provision(userId);
        val payload = Map.<String, Object>of("days", userConfig.getTrialDays(), "endAt", accessEndsAt);
        if (provisioning == ProvisioningStatus.PROVISIONED) {
            notificationServiceContract.notify(userId, NotificationKind.TRIAL_ACTIVATED, "trial:" + userId, payload);
        } else if (provisioning == ProvisioningStatus.DEFERRED) {
            notificationServiceContract.notify(userId, NotificationKind.PROVISIONING_DELAYED, "trial:" + userId, payload);
        }

        return TrialResponse.builder()
            .accessEndsAt(accessEndsAt)
            .provisioning(provisioning)
            .build();
    }

    @NonNull
    private static UserResponse buildUserResponse(@NonNull User user) {
        return UserResponse.builder()
            .id(user.getId())
            .username(user.getUsername())
            .firstName(user.getFirstName())
            .lastName(user.getLastName())
            .languageCode(user.getLanguageCode())
            .hasTrial(user.isHasTrial())
            .createdAt(user.getCreatedAt())
            .build();
    }
}

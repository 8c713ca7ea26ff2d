package com.vpnbot.api.referral;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.contracts.NotificationServiceContract;
import com.vpnbot.api.contracts.PaymentHistoryContract;
import com.vpnbot.api.contracts.ReferralServiceContract;
import com.vpnbot.api.contracts.SubscriptionServiceContract;
import com.vpnbot.api.contracts.UserServiceContract;
import com.vpnbot.api.referral.entities.Referral;
import com.vpnbot.api.referral.entities.ReferralLink;
import com.vpnbot.api.referral.entities.ReferralLinkRepository;
import com.vpnbot.api.referral.entities.ReferralRepository;
import com.vpnbot.api.referral.exceptions.ReferralLinkNotFoundException;
import com.vpnbot.api.referral.exceptions.ReferrerNotFoundException;
import com.vpnbot.api.referral.payload.ReferralLinkResponse;
import com.vpnbot.api.referral.payload.ReferralStatsResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ReferralService} implements operations related to referral links and referral bonuses.
 */
@Service
@Slf4j
class ReferralService implements ReferralServiceContract {

    private static final String CODE_ALPHABET = "abcdefghijkmnpqrstuvwxyz23456789";
    private static final int MAX_CODE_ATTEMPTS = 5;

    private final ReferralConfiguration referralConfig;
    private final ReferralRepository referralRepository;
    private final ReferralLinkRepository referralLinkRepository;
    private final PaymentHistoryContract paymentHistoryContract;
    private final SubscriptionServiceContract subscriptionServiceContract;
    private final NotificationServiceContract notificationServiceContract;
    private final UserServiceContract userServiceContract;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Autowired
    ReferralService(
        @NonNull ReferralConfiguration referralConfig,
        @NonNull ReferralRepository referralRepository,
        @NonNull ReferralLinkRepository referralLinkRepository,
        @NonNull PaymentHistoryContract paymentHistoryContract,
        @NonNull SubscriptionServiceContract subscriptionServiceContract,
        @NonNull NotificationServiceContract notificationServiceContract,
        @NonNull UserServiceContract userServiceContract,
        @NonNull Clock clock
    ) {
        this.referralConfig = referralConfig;
        this.referralRepository = referralRepository;
        this.referralLinkRepository = referralLinkRepository;
        this.paymentHistoryContract = paymentHistoryContract;
        this.subscriptionServiceContract = subscriptionServiceContract;
        this.notificationServiceContract = notificationServiceContract;
        this.userServiceContract = userServiceContract;
        this.clock = clock;
    }

    /**
     * <p>
     * The referral row is read with an exclusive lock, so concurrent credits for one referee run
     * one after another. A recorded {@link NotificationKind#REFERRAL_BONUS} notification with the
     * reference {@code referee:<userId>} marks the credit as done; its unique constraint rejects a
     * second credit even if the lock is bypassed.</p>
     */
    @NonNull
    @Override
    @Transactional(propagation = Propagation.MANDATORY, rollbackFor = Throwable.class)
    public Optional<ReferralCredit> creditIfEligible(long userId, @NonNull String paymentId) {
        val referral = referralRepository.findWithLockByRefereeId(userId).orElse(null);
        if (referral == null) {
            return Optional.empty();
        }

        val completedPaymentIds = paymentHistoryContract.findCompletedPaymentIds(userId);
        if (completedPaymentIds.size() != 1 || !completedPaymentIds.contains(paymentId)) {
            log.debug("payment {} isn't the first payment of referee {}", paymentId, userId);
            return Optional.empty();
        }

        val referrerId = referral.getReferrerId();
        val reference = "referee:" + userId;
        if (referral.getCreditedAt() != null
            || notificationServiceContract.exists(referrerId, NotificationKind.REFERRAL_BONUS, reference)) {
            return Optional.empty();
        }

        val now = OffsetDateTime.now(clock);
        val bonusDays = referralConfig.getBonusDays();
        val accessEndsAt = subscriptionServiceContract.grantDays(referrerId, bonusDays, now);
        referral.setCreditedAt(now);
        referral.setBonusDays(bonusDays);
        referralRepository.save(referral);
        notificationServiceContract.record(
            referrerId, NotificationKind.REFERRAL_BONUS, reference, Map.of("days", bonusDays, "endAt", accessEndsAt));

        log.info("credited referrer {} with {} days for referee {}", referrerId, bonusDays, userId);
        return Optional.of(ReferralCredit.builder()
            .referrerId(referrerId)
            .refereeId(userId)
            .bonusDays(bonusDays)
            .accessEndsAt(accessEndsAt)
            .build());
    }

    @Override
    @Transactional(rollbackFor = Throwable.class)
    public boolean registerReferral(long refereeId, @NonNull String referralCode) {
        val link = referralLinkRepository.findActiveByCode(referralCode.trim()).orElse(null);
        if (link == null) {
            log.debug("referral code {} is unknown or inactive", referralCode);
            return false;
        }

        if (link.getUserId() == refereeId || referralRepository.existsByRefereeId(refereeId)) {
            return false;
        }

        referralRepository.save(
            Referral.builder()
                .referrerId(link.getUserId())
                .refereeId(refereeId)
                .createdAt(OffsetDateTime.now(clock))
                .build());

        log.info("user {} was referred by user {}", refereeId, link.getUserId());
        return true;
    }

    /**
     * Returns the user's referral link, creating one with a random code on the first call.
     *
     * @throws ReferrerNotFoundException if the user isn't registered.
     */
    @NonNull
    @Transactional(rollbackFor = Throwable.class)
    ReferralLinkResponse getOrCreateLink(long userId) throws ReferrerNotFoundException {
        val existing = referralLinkRepository.findByUserId(userId);
        if (existing.isPresent()) {
            return buildLinkResponse(existing.get());
        }

        if (!userServiceContract.isRegistered(userId)) {
            throw new ReferrerNotFoundException("user doesn't exist");
        }

        val now = OffsetDateTime.now(clock);
        val link = referralLinkRepository.save(
            ReferralLink.builder()
                .userId(userId)
                .code(newCode())
                .createdAt(now)
                .updatedAt(now)
                .build());

        return buildLinkResponse(link);
    }

    /**
     * @throws ReferralLinkNotFoundException if the user hasn't created a link yet.
     */
    @NonNull
    @Transactional(rollbackFor = Throwable.class)
    ReferralLinkResponse setLinkActive(long userId, boolean isActive) throws ReferralLinkNotFoundException {
        val link = referralLinkRepository.findByUserId(userId)
            .orElseThrow(() -> new ReferralLinkNotFoundException("referral link doesn't exist"));

        if (link.isActive() != isActive) {
            link.setActive(isActive);
            link.setUpdatedAt(OffsetDateTime.now(clock));
            referralLinkRepository.save(link);
        }

        return buildLinkResponse(link);
    }

    /**
     * @throws ReferrerNotFoundException if the user isn't registered.
     */
    @NonNull
    ReferralStatsResponse getStats(long userId) throws ReferrerNotFoundException {
        if (!userServiceContract.isRegistered(userId)) {
            throw new ReferrerNotFoundException("user doesn't exist");
        }

        return ReferralStatsResponse.builder()
            .referrals(referralRepository.countByReferrerId(userId))
            .creditedReferrals(referralRepository.countCreditedByReferrerId(userId))
            .bonusDays(referralRepository.sumBonusDaysByReferrerId(userId))
            .build();
    }

    @NonNull
    private String newCode() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            val code = new StringBuilder(referralConfig.getCodeLength());
            for (int i = 0; i < referralConfig.getCodeLength(); i++) {
                code.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
            }

            if (!referralLinkRepository.existsByCode(code.toString())) {
                return code.toString();
            }
        }

        throw new IllegalStateException("failed to generate a unique referral code");
    }

    @NonNull
    private ReferralLinkResponse buildLinkResponse(@NonNull ReferralLink link) {
        return ReferralLinkResponse.builder()
            .code(link.getCode())
            .link(referralConfig.getLinkBase() + link.getCode())
            .isActive(link.isActive())
            .build();
    }
}

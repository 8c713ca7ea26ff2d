package com.vpnbot.api.promocode;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.contracts.NotificationServiceContract;
import com.vpnbot.api.contracts.ProvisioningStatus;
import com.vpnbot.api.contracts.SubscriptionServiceContract;
import com.vpnbot.api.contracts.UserServiceContract;
import com.vpnbot.api.contracts.VpnServiceContract;
import com.vpnbot.api.platform.transaction.UnitOfWork;
import com.vpnbot.api.promocode.entities.Promocode;
import com.vpnbot.api.promocode.entities.PromocodeRedemption;
import com.vpnbot.api.promocode.entities.PromocodeRedemptionRepository;
import com.vpnbot.api.promocode.entities.PromocodeRepository;
import com.vpnbot.api.promocode.exceptions.DuplicatePromocodeException;
import com.vpnbot.api.promocode.exceptions.PromocodeExhaustedException;
import com.vpnbot.api.promocode.exceptions.PromocodeExpiredException;
import com.vpnbot.api.promocode.exceptions.PromocodeNotFoundException;
import com.vpnbot.api.promocode.exceptions.PromocodeRedeemedException;
import com.vpnbot.api.promocode.exceptions.PromocodeRedemptionException;
import com.vpnbot.api.promocode.exceptions.RedeemerNotFoundException;
import com.vpnbot.api.promocode.payload.CreatePromocodeParams;
import com.vpnbot.api.promocode.payload.PromocodeRedemptionResponse;
import com.vpnbot.api.promocode.payload.PromocodeResponse;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link PromocodeService} implements operations related to promo codes that grant extra access
 * days.
 */
@Service
@Slf4j
class PromocodeService {

    private final PromocodeRepository promocodeRepository;
    private final PromocodeRedemptionRepository redemptionRepository;
    private final UserServiceContract userServiceContract;
    private final SubscriptionServiceContract subscriptionServiceContract;
    private final VpnServiceContract vpnServiceContract;
    private final NotificationServiceContract notificationServiceContract;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    @Autowired
    PromocodeService(
        @NonNull PromocodeRepository promocodeRepository,
        @NonNull PromocodeRedemptionRepository redemptionRepository,
        @NonNull UserServiceContract userServiceContract,
        @NonNull SubscriptionServiceContract subscriptionServiceContract,
        @NonNull VpnServiceContract vpnServiceContract,
        @NonNull NotificationServiceContract notificationServiceContract,
        @NonNull UnitOfWork unitOfWork,
        @NonNull Clock clock
    ) {
        this.promocodeRepository = promocodeRepository;
        this.redemptionRepository = redemptionRepository;
        this.userServiceContract = userServiceContract;
        this.subscriptionServiceContract = subscriptionServiceContract;
        this.vpnServiceContract = vpnServiceContract;
        this.notificationServiceContract = notificationServiceContract;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    /**
     * @throws DuplicatePromocodeException if a promo code with the same (case-insensitive) code
     *                                     already exists.
     */
    @NonNull
    PromocodeResponse createPromocode(@NonNull CreatePromocodeParams params) throws DuplicatePromocodeException {
        val code = normalize(params.getCode());
        if (promocodeRepository.existsByCode(code)) {
            throw new DuplicatePromocodeException("promo code already exists");
        }

        val now = OffsetDateTime.now(clock);
        val promocode = promocodeRepository.save(
            Promocode.builder()
                .code(code)
                .days(params.getDays())
                .usageLimit(params.getUsageLimit() == null ? 0 : params.getUsageLimit())
                .expiresAt(params.getExpiresAt())
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.info("created promo code {} for {} days", code, promocode.getDays());
        return buildPromocodeResponse(promocode, now);
    }

    @NonNull
    List<PromocodeResponse> listPromocodes() {
        val now = OffsetDateTime.now(clock);
        return promocodeRepository.findAllActive()
            .stream()
            .map(promocode -> buildPromocodeResponse(promocode, now))
            .collect(Collectors.toList());
    }

    @NonNull
    PromocodeResponse getPromocode(@NonNull String code) throws PromocodeNotFoundException {
        return promocodeRepository.findByCode(normalize(code))
            .map(promocode -> buildPromocodeResponse(promocode, OffsetDateTime.now(clock)))
            .orElseThrow(() -> new PromocodeNotFoundException("promo code doesn't exist"));
    }

    /**
     * Stops further redemptions of a promo code. Redemptions made before are not revoked.
     */
    @NonNull
    PromocodeResponse deactivatePromocode(@NonNull String code) throws PromocodeNotFoundException {
        return unitOfWork.execute(() -> {
            val promocode = promocodeRepository.findWithLockByCode(normalize(code))
                .orElseThrow(() -> new PromocodeNotFoundException("promo code doesn't exist"));

            val now = OffsetDateTime.now(clock);
            if (promocode.isActive()) {
                promocode.setActive(false);
                promocode.setUpdatedAt(now);
                promocodeRepository.save(promocode);
                log.info("deactivated promo code {}", promocode.getCode());
            }

            return buildPromocodeResponse(promocode, now);
        });
    }

    /**
     * <p>
     * Grants the promo code's days to the user, and provisions their VPN account once the grant has
     * committed.</p>
     *
     * <p>
     * The promo code row is locked for the duration of the grant, so concurrent redemptions never
     * exceed its usage limit and a user never redeems the same code twice.</p>
     *
     * @throws RedeemerNotFoundException     if the user isn't registered.
     * @throws PromocodeRedemptionException if the code can't be redeemed: {@link
     *                                       PromocodeNotFoundException} for unknown and deactivated
     *                                       codes, {@link PromocodeExpiredException}, {@link
     *                                       PromocodeExhaustedException} or {@link
     *                                       PromocodeRedeemedException}.
     */
    @NonNull
    PromocodeRedemptionResponse redeemPromocode(long userId, @NonNull String code)
        throws RedeemerNotFoundException, PromocodeRedemptionException {
        if (!userServiceContract.isRegistered(userId)) {
            throw new RedeemerNotFoundException("user isn't registered");
        }

        val normalized = normalize(code);
        final Grant grant = unitOfWork.execute(() -> {
            val promocode = promocodeRepository.findWithLockByCode(normalized)
                .filter(Promocode::isActive)
                .orElseThrow(() -> new PromocodeNotFoundException("promo code doesn't exist"));

            val now = OffsetDateTime.now(clock);
            if (promocode.isExpiredAt(now)) {
                throw new PromocodeExpiredException("promo code has expired");
            }

            if (redemptionRepository.existsByPromocodeIdAndUserId(promocode.getId(), userId)) {
                throw new PromocodeRedeemedException("user has already redeemed this promo code");
            }

            if (promocode.isExhausted()) {
                throw new PromocodeExhaustedException("promo code has reached its usage limit");
            }

            promocode.setUsedCount(promocode.getUsedCount() + 1);
            promocode.setUpdatedAt(now);
            promocodeRepository.save(promocode);
            redemptionRepository.save(
                PromocodeRedemption.builder()
                    .promocodeId(promocode.getId())
                    .userId(userId)
                    .days(promocode.getDays())
                    .createdAt(now)
                    .build());

            val accessEndsAt = subscriptionServiceContract.grantDays(userId, promocode.getDays(), now);
            return new Grant(promocode.getId(), promocode.getCode(), promocode.getDays(), accessEndsAt);
        });

        log.info("user {} redeemed promo code {} until {}", userId, grant.code, grant.accessEndsAt);
        val provisioning = vpnServiceContract.provision(userId);
        val reference = "promocode:" + grant.promocodeId;
        val payload = Map.<String, Object>of("code", grant.code, "days", grant.days, "endAt", grant.accessEndsAt);
        if (provisioning == ProvisioningStatus.PROVISIONED) {
            notificationServiceContract.notify(userId, NotificationKind.PROMOCODE_REDEEMED, reference, payload);
        } else if (provisioning == ProvisioningStatus.DEFERRED) {
            notificationServiceContract.notify(userId, NotificationKind.PROVISIONING_DELAYED, reference, payload);
        }

        return PromocodeRedemptionResponse.builder()
            .code(grant.code)
            .days(grant.days)
            .accessEndsAt(grant.accessEndsAt)
            .provisioning(provisioning)
            .build();
    }

    @NonNull
    static String normalize(@NonNull String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    @NonNull
    private static PromocodeResponse buildPromocodeResponse(@NonNull Promocode promocode, @NonNull OffsetDateTime now) {
        return PromocodeResponse.builder()
            .code(promocode.getCode())
            .days(promocode.getDays())
            .usageLimit(promocode.getUsageLimit())
            .usedCount(promocode.getUsedCount())
            .isActive(promocode.isActive())
            .expiresAt(promocode.getExpiresAt())
            .isRedeemable(promocode.isActive() && !promocode.isExpiredAt(now) && !promocode.isExhausted())
            .build();
    }

    @AllArgsConstructor
    private static class Grant {
        final long promocodeId;
        final String code;
        final int days;
        final OffsetDateTime accessEndsAt;
    }
}

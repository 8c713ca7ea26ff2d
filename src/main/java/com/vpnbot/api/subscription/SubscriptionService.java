package com.vpnbot.api.subscription;

import com.vpnbot.api.contracts.SubscriptionServiceContract;
import com.vpnbot.api.contracts.UserServiceContract;
import com.vpnbot.api.subscription.entities.Plan;
import com.vpnbot.api.subscription.entities.PlanRepository;
import com.vpnbot.api.subscription.entities.Subscription;
import com.vpnbot.api.subscription.entities.SubscriptionRepository;
import com.vpnbot.api.subscription.exceptions.PlanNotFoundException;
import com.vpnbot.api.subscription.exceptions.SubscriptionNotFoundException;
import com.vpnbot.api.subscription.payload.PlanResponse;
import com.vpnbot.api.subscription.payload.SubscriptionResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link SubscriptionService} implements operations related to plans and users' access windows.
 */
@Service
@Slf4j
class SubscriptionService implements SubscriptionServiceContract {

    private final SubscriptionConfiguration subscriptionConfig;
    private final PlanRepository planRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final UserServiceContract userServiceContract;
    private final Clock clock;

    @Autowired
    SubscriptionService(
        @NonNull SubscriptionConfiguration subscriptionConfig,
        @NonNull PlanRepository planRepository,
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull UserServiceContract userServiceContract,
        @NonNull Clock clock
    ) {
        this.subscriptionConfig = subscriptionConfig;
        this.planRepository = planRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.userServiceContract = userServiceContract;
        this.clock = clock;
    }

    /**
     * @return a non-null list of plans that are currently on sale, cheapest first.
     */
    @NonNull
    List<PlanResponse> listPlans() {
        return planRepository.findAllActive()
            .stream()
            .map(SubscriptionService::buildPlanResponse)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @param userId id of the subscription owner.
     * @return the user's current subscription, i.e. the active one with the latest {@code endAt}.
     * @throws SubscriptionNotFoundException if the user doesn't have an active subscription.
     */
    @NonNull
    SubscriptionResponse getCurrentSubscription(long userId) throws SubscriptionNotFoundException {
        return subscriptionRepository.findCurrentByUserId(userId)
            .map(s -> buildSubscriptionResponse(s, OffsetDateTime.now(clock)))
            .orElseThrow(() -> new SubscriptionNotFoundException("user doesn't have an active subscription"));
    }

    /**
     * <p>
     * Extends the user's access window by the plan's duration.</p>
     *
     * <ul>
     *     <li>If the user has no current subscription, or it has already ended ({@code endAt <=
     *     now}), a new subscription with {@code startAt = now} and {@code endAt = now +
     *     durationDays} is created.</li>
     *     <li>Otherwise, the current subscription is extended according to the configured {@link
     *     SubscriptionConfiguration.RenewalPolicy renewal policy}.</li>
     * </ul>
     *
     * <p>It mutates the ledger only and joins the caller's transaction.</p>
     */
    @NonNull
    @Override
    @Transactional(propagation = Propagation.MANDATORY, rollbackFor = Throwable.class)
    public OffsetDateTime grantAccess(long userId, @NonNull String planId, @NonNull OffsetDateTime now) throws PlanNotFoundException {
        val plan = planRepository.findById(planId)
            .orElseThrow(() -> new PlanNotFoundException("plan doesn't exist"));

        return grant(userId, plan, plan.getDurationDays(), now).getEndAt();
    }

    @NonNull
    @Override
    @Transactional(propagation = Propagation.MANDATORY, rollbackFor = Throwable.class)
    public OffsetDateTime grantDays(long userId, int days, @NonNull OffsetDateTime now) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be positive");
        }

        return grant(userId, null, days, now).getEndAt();
    }

    @Override
    public boolean hasValidSubscription(long userId, @NonNull OffsetDateTime at) {
        return subscriptionRepository.existsValidByUserId(userId, at);
    }

    @NonNull
    @Override
    public Set<Long> findUsersWithValidSubscription(@NonNull OffsetDateTime at) {
        return new HashSet<>(subscriptionRepository.findAllUserIdsWithValidSubscription(at));
    }

    @NonNull
    @Override
    public PlanQuote quotePlan(@NonNull String planId) throws PlanNotFoundException {
        val plan = planRepository.findActiveById(planId)
            .orElseThrow(() -> new PlanNotFoundException("plan doesn't exist or isn't on sale"));

        return PlanQuote.builder()
            .planId(plan.getId())
            .name(plan.getName())
            .price(plan.getPrice())
            .currency(plan.getCurrency())
            .durationDays(plan.getDurationDays())
            .build();
    }

    @NonNull
    private Subscription grant(long userId, Plan plan, int days, @NonNull OffsetDateTime now) {
        // concurrent grants for the same user must not both open a new window.
        if (!userServiceContract.lockUser(userId)) {
            throw new IllegalArgumentException("user doesn't exist: " + userId);
        }

        val current = subscriptionRepository.findCurrentByUserId(userId).orElse(null);
        if (current == null || !current.getEndAt().isAfter(now)) {
            log.debug("opening a new access window for user {}", userId);
            return subscriptionRepository.save(
                Subscription.builder()
                    .userId(userId)
                    .plan(plan)
                    .createdAt(now)
                    .updatedAt(now)
                    .startAt(now)
                    .endAt(now.plusDays(days))
                    .build());
        }

        final OffsetDateTime endAt;
        switch (subscriptionConfig.getRenewalPolicy()) {
            case RESET:
                endAt = now.plusDays(days);
                break;
            case STACK:
            default:
                endAt = current.getEndAt().plusDays(days);
                break;
        }

        log.debug("extending subscription {} of user {} until {}", current.getId(), userId, endAt);
        current.setEndAt(endAt);
        current.setUpdatedAt(now);
        if (plan != null) {
            current.setPlan(plan);
        }

        return subscriptionRepository.save(current);
    }

    @NonNull
    static PlanResponse buildPlanResponse(@NonNull Plan plan) {
        return PlanResponse.builder()
            .id(plan.getId())
            .name(plan.getName())
            .description(plan.getDescription())
            .price(plan.getPrice())
            .currency(plan.getCurrency())
            .durationDays(plan.getDurationDays())
            .build();
    }

    @NonNull
    static SubscriptionResponse buildSubscriptionResponse(@NonNull Subscription subscription, @NonNull OffsetDateTime now) {
        val remaining = subscription.getEndAt().isAfter(now)
            ? Duration.between(now, subscription.getEndAt()).toDays()
            : 0L;

        return SubscriptionResponse.builder()
            .id(subscription.getId())
            .plan(subscription.getPlan() == null ? null : buildPlanResponse(subscription.getPlan()))
            .startAt(subscription.getStartAt())
            .endAt(subscription.getEndAt())
            .isValid(subscription.isValidAt(now))
            .daysRemaining(remaining)
            .build();
    }
}

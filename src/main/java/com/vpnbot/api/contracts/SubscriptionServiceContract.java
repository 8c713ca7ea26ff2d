package com.vpnbot.api.contracts;

import com.vpnbot.api.subscription.exceptions.PlanNotFoundException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Set;

/**
 * Defines a service contract for subscription service to provide access window operations to the
 * payment, referral, user and vpn services.
 */
public interface SubscriptionServiceContract {

    /**
     * Extends (or opens) the access window of a user by the duration of a plan. It must be invoked
     * from inside the caller's ledger transaction.
     *
     * @param userId id of the user receiving access.
     * @param planId id of the purchased plan.
     * @param now    the instant used for expiry checks and for new windows.
     * @return the end of the user's access window after the grant.
     * @throws PlanNotFoundException if a plan with the given id doesn't exist.
     */
    @NonNull
    OffsetDateTime grantAccess(long userId, @NonNull String planId, @NonNull OffsetDateTime now) throws PlanNotFoundException;

    /**
     * Same as {@link #grantAccess(long, String, OffsetDateTime)}, for grants that aren't backed by
     * a plan purchase, e.g. trials and referral bonuses.
     */
    @NonNull
    OffsetDateTime grantDays(long userId, int days, @NonNull OffsetDateTime now);

    /**
     * @return {@code true} if the user owns an active subscription with {@code startAt <= at <
     * endAt}.
     */
    boolean hasValidSubscription(long userId, @NonNull OffsetDateTime at);

    /**
     * @return ids of all users that own a valid subscription at the given instant.
     */
    @NonNull
    Set<Long> findUsersWithValidSubscription(@NonNull OffsetDateTime at);

    /**
     * @param planId id of an active plan.
     * @return pricing details of the plan.
     * @throws PlanNotFoundException if an active plan with the given id doesn't exist.
     */
    @NonNull
    PlanQuote quotePlan(@NonNull String planId) throws PlanNotFoundException;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class PlanQuote {

        @NonNull
        private String planId;

        @NonNull
        private String name;

        @NonNull
        private BigDecimal price;

        @NonNull
        private String currency;

        private int durationDays;
    }
}

package com.vpnbot.api.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Defines a service contract for referral service to provide referral operations to the payment
 * and user services.
 */
public interface ReferralServiceContract {

    /**
     * Credits the referrer of {@code userId} with bonus access if {@code paymentId} is the user's
     * first and only completed payment, and the referrer hasn't been credited for this user yet. It
     * must be invoked from inside the caller's ledger transaction.
     *
     * @return the applied credit, or empty if the user isn't eligible.
     */
    @NonNull
    Optional<ReferralCredit> creditIfEligible(long userId, @NonNull String paymentId);

    /**
     * Links a newly registered user to the owner of an active referral link.
     *
     * @param refereeId    id of the newly registered user.
     * @param referralCode code of the referral link the user followed.
     * @return {@code true} if a referral was created.
     */
    boolean registerReferral(long refereeId, @NonNull String referralCode);

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ReferralCredit {

        private long referrerId;

        private long refereeId;

        private int bonusDays;

        @NonNull
        private OffsetDateTime accessEndsAt;
    }
}

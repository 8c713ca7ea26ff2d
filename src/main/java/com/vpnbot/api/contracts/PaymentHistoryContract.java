package com.vpnbot.api.contracts;

import lombok.NonNull;

import java.util.List;

/**
 * Defines a read-only contract over the payment ledger for the referral service.
 */
public interface PaymentHistoryContract {

    /**
     * @param userId id of the payer.
     * @return ids of all completed payments of the user, including the ones completed in the
     * caller's ongoing transaction.
     */
    @NonNull
    List<String> findCompletedPaymentIds(long userId);
}

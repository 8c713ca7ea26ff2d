package com.vpnbot.api.payment;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.contracts.NotificationServiceContract;
import com.vpnbot.api.contracts.ProvisioningStatus;
import com.vpnbot.api.contracts.ReferralServiceContract;
import com.vpnbot.api.contracts.ReferralServiceContract.ReferralCredit;
import com.vpnbot.api.contracts.SubscriptionServiceContract;
import com.vpnbot.api.contracts.UserServiceContract;
import com.vpnbot.api.contracts.VpnServiceContract;
import com.vpnbot.api.payment.entities.Payment;
import com.vpnbot.api.payment.entities.PaymentRepository;
import com.vpnbot.api.payment.exceptions.PayerNotFoundException;
import com.vpnbot.api.payment.exceptions.PaymentNotFoundException;
import com.vpnbot.api.payment.exceptions.PaymentStateException;
import com.vpnbot.api.payment.payload.CreatePaymentParams;
import com.vpnbot.api.payment.payload.PaymentCompletionResponse;
import com.vpnbot.api.payment.payload.PaymentResponse;
import com.vpnbot.api.platform.transaction.UnitOfWork;
import com.vpnbot.api.subscription.exceptions.PlanNotFoundException;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * <p>
 * {@link PaymentService} implements operations related to payments. Completing a payment is a
 * saga over the ledger, the VPN panel and the users' chats:</p>
 *
 * <ol>
 *     <li>a single ledger transaction marks the payment completed, extends the payer's access
 *     window and credits their referrer;</li>
 *     <li>after it commits, the payer's (and a credited referrer's) panel account is
 *     provisioned;</li>
 *     <li>last, the payer is told whether their access is ready or still being set up.</li>
 * </ol>
 *
 * <p>
 * A failure in the first step rolls it back as a whole, leaving the payment pending and safe to
 * retry. Failures after the commit never undo it; the provisioning step records them for the
 * expiry sweeper to retry.</p>
 */
@Service
@Slf4j
class PaymentService {

    private final PaymentRepository paymentRepository;
    private final UserServiceContract userServiceContract;
    private final SubscriptionServiceContract subscriptionServiceContract;
    private final ReferralServiceContract referralServiceContract;
    private final VpnServiceContract vpnServiceContract;
    private final NotificationServiceContract notificationServiceContract;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    @Autowired
    PaymentService(
        @NonNull PaymentRepository paymentRepository,
        @NonNull UserServiceContract userServiceContract,
        @NonNull SubscriptionServiceContract subscriptionServiceContract,
        @NonNull ReferralServiceContract referralServiceContract,
        @NonNull VpnServiceContract vpnServiceContract,
        @NonNull NotificationServiceContract notificationServiceContract,
        @NonNull UnitOfWork unitOfWork,
        @NonNull Clock clock
    ) {
        this.paymentRepository = paymentRepository;
        this.userServiceContract = userServiceContract;
        this.subscriptionServiceContract = subscriptionServiceContract;
        this.referralServiceContract = referralServiceContract;
        this.vpnServiceContract = vpnServiceContract;
        this.notificationServiceContract = notificationServiceContract;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    /**
     * Creates a pending payment for a plan, priced from the plan's current offer.
     *
     * @throws PayerNotFoundException if the user isn't registered.
     * @throws PlanNotFoundException  if the plan doesn't exist or isn't on sale.
     */
    @NonNull
    @Transactional(rollbackFor = Throwable.class)
    PaymentResponse createPayment(@NonNull CreatePaymentParams params) throws PayerNotFoundException, PlanNotFoundException {
        if (!userServiceContract.isRegistered(params.getUserId())) {
            throw new PayerNotFoundException("user doesn't exist");
        }

        val quote = subscriptionServiceContract.quotePlan(params.getPlanId());
        val now = OffsetDateTime.now(clock);
        val payment = paymentRepository.save(
            Payment.builder()
                .id(UUID.randomUUID().toString())
                .userId(params.getUserId())
                .planId(quote.getPlanId())
                .amount(quote.getPrice())
                .currency(quote.getCurrency())
                .method(params.getMethod())
                .description(quote.getName())
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.info("created payment {} of user {} for plan {}", payment.getId(), payment.getUserId(), payment.getPlanId());
        return buildPaymentResponse(payment);
    }

    @NonNull
    PaymentResponse getPayment(@NonNull String paymentId) throws PaymentNotFoundException {
        return paymentRepository.findById(paymentId)
            .map(PaymentService::buildPaymentResponse)
            .orElseThrow(() -> new PaymentNotFoundException("payment doesn't exist"));
    }

    /**
     * <p>
     * Completes a pending payment and grants the payer access for the duration of its plan.
     * Completing an already completed payment succeeds without repeating any side effect, so the
     * payment provider may deliver its confirmation more than once.</p>
     *
     * @throws PaymentNotFoundException if the payment doesn't exist.
     * @throws PaymentStateException    if the payment has failed or has been refunded.
     */
    @NonNull
    PaymentCompletionResponse completePayment(@NonNull String paymentId) throws PaymentNotFoundException, PaymentStateException {
        if (!paymentRepository.existsById(paymentId)) {
            throw new PaymentNotFoundException("payment doesn't exist");
        }

        final Completion completion = unitOfWork.execute(() -> {
            val payment = paymentRepository.findWithLockById(paymentId)
                .orElseThrow(() -> new IllegalStateException("payment disappeared during completion"));

            if (payment.getStatus() == Payment.Status.COMPLETED) {
                return new Completion(payment, true, null, null);
            }

            if (payment.getStatus() != Payment.Status.PENDING) {
                throw new PaymentStateException("payment is " + payment.getStatus().name().toLowerCase());
            }

            val now = OffsetDateTime.now(clock);
            payment.setStatus(Payment.Status.COMPLETED);
            payment.setCompletedAt(now);
            payment.setUpdatedAt(now);
            paymentRepository.save(payment);

            final OffsetDateTime accessEndsAt;
            try {
                accessEndsAt = subscriptionServiceContract.grantAccess(payment.getUserId(), payment.getPlanId(), now);
            } catch (PlanNotFoundException e) {
                throw new IllegalStateException("plan of payment " + paymentId + " doesn't exist", e);
            }

            val credit = referralServiceContract.creditIfEligible(payment.getUserId(), paymentId).orElse(null);
            return new Completion(payment, false, accessEndsAt, credit);
        });

        val payment = completion.payment;
        if (completion.isDuplicate) {
            log.info("payment {} was already completed", paymentId);
            return PaymentCompletionResponse.builder()
                .paymentId(paymentId)
                .status(payment.getStatus())
                .isDuplicate(true)
                .build();
        }

        log.info("completed payment {} of user {}, access ends at {}", paymentId, payment.getUserId(), completion.accessEndsAt);
        val provisioning = vpnServiceContract.provision(payment.getUserId());
        notifyPayer(payment, completion.accessEndsAt, provisioning);
        if (completion.credit != null) {
            rewardReferrer(completion.credit);
        }

        return PaymentCompletionResponse.builder()
            .paymentId(paymentId)
            .status(payment.getStatus())
            .isDuplicate(false)
            .provisioning(provisioning)
            .accessEndsAt(completion.accessEndsAt)
            .build();
    }

    /**
     * Marks a pending payment as failed. Failing an already failed payment is a no-op.
     *
     * @throws PaymentNotFoundException if the payment doesn't exist.
     * @throws PaymentStateException    if the payment has already been completed.
     */
    @NonNull
    PaymentResponse failPayment(@NonNull String paymentId) throws PaymentNotFoundException, PaymentStateException {
        return transition(paymentId, Payment.Status.PENDING, Payment.Status.FAILED);
    }

    /**
     * Marks a completed payment as refunded. The payer keeps the access they were granted; revoking
     * it is left to an operator.
     *
     * @throws PaymentNotFoundException if the payment doesn't exist.
     * @throws PaymentStateException    if the payment hasn't been completed.
     */
    @NonNull
    PaymentResponse refundPayment(@NonNull String paymentId) throws PaymentNotFoundException, PaymentStateException {
        return transition(paymentId, Payment.Status.COMPLETED, Payment.Status.REFUNDED);
    }

    @NonNull
    private PaymentResponse transition(
        @NonNull String paymentId,
        @NonNull Payment.Status from,
        @NonNull Payment.Status to
    ) throws PaymentNotFoundException, PaymentStateException {
        if (!paymentRepository.existsById(paymentId)) {
            throw new PaymentNotFoundException("payment doesn't exist");
        }

        return unitOfWork.execute(() -> {
            val payment = paymentRepository.findWithLockById(paymentId)
                .orElseThrow(() -> new IllegalStateException("payment disappeared during a status change"));

            if (payment.getStatus() == to) {
                return buildPaymentResponse(payment);
            }

            if (payment.getStatus() != from) {
                throw new PaymentStateException(String.format(
                    "can't change payment status from %s to %s", payment.getStatus(), to));
            }

            payment.setStatus(to);
            payment.setUpdatedAt(OffsetDateTime.now(clock));
            log.info("payment {} is {} now", paymentId, to.name().toLowerCase());
            return buildPaymentResponse(paymentRepository.save(payment));
        });
    }

    private void notifyPayer(@NonNull Payment payment, @NonNull OffsetDateTime accessEndsAt, @NonNull ProvisioningStatus provisioning) {
        val payload = new HashMap<String, Object>();
        payload.put("planName", payment.getDescription() != null ? payment.getDescription() : payment.getPlanId());
        payload.put("endAt", accessEndsAt);
        payload.put("amount", payment.getAmount());
        payload.put("currency", payment.getCurrency());

        val reference = "payment:" + payment.getId();
        switch (provisioning) {
            case PROVISIONED:
                notificationServiceContract.notify(payment.getUserId(), NotificationKind.PAYMENT_SUCCEEDED, reference, payload);
                break;
            case DEFERRED:
                notificationServiceContract.notify(payment.getUserId(), NotificationKind.PROVISIONING_DELAYED, reference, payload);
                break;
            case FAILED:
                notificationServiceContract.notify(payment.getUserId(), NotificationKind.PAYMENT_RECEIVED, reference, payload);
                break;
        }
    }

    private void rewardReferrer(@NonNull ReferralCredit credit) {
        val provisioning = vpnServiceContract.provision(credit.getReferrerId());
        log.info("provisioned referrer {} after bonus: {}", credit.getReferrerId(), provisioning);
        notificationServiceContract.dispatch(
            credit.getReferrerId(),
            NotificationKind.REFERRAL_BONUS,
            Map.of("days", credit.getBonusDays(), "endAt", credit.getAccessEndsAt()));
    }

    @NonNull
    private static PaymentResponse buildPaymentResponse(@NonNull Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .userId(payment.getUserId())
            .planId(payment.getPlanId())
            .amount(payment.getAmount())
            .currency(payment.getCurrency())
            .method(payment.getMethod())
            .description(payment.getDescription())
            .status(payment.getStatus())
            .createdAt(payment.getCreatedAt())
            .completedAt(payment.getCompletedAt())
            .build();
    }

    @AllArgsConstructor
    private static class Completion {
        final Payment payment;
        final boolean isDuplicate;
        final OffsetDateTime accessEndsAt;
        final ReferralCredit credit;
    }
}

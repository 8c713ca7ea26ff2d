package com.vpnbot.api.payment;

import com.vpnbot.api.contracts.PaymentHistoryContract;
import com.vpnbot.api.payment.entities.PaymentRepository;
import lombok.NonNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
class PaymentHistoryService implements PaymentHistoryContract {

    private final PaymentRepository paymentRepository;

    @Autowired
    PaymentHistoryService(@NonNull PaymentRepository paymentRepository) {
        this.paymentRepository = paymentRepository;
    }

    @NonNull
    @Override
    public List<String> findCompletedPaymentIds(long userId) {
        return paymentRepository.findAllCompletedIdsByUserId(userId);
    }
}

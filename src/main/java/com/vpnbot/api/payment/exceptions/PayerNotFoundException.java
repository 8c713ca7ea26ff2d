package com.vpnbot.api.payment.exceptions;

/**
 * Thrown by createPayment operation in PaymentService.
 */
public class PayerNotFoundException extends Exception {

    public PayerNotFoundException(String message) {
        super(message);
    }
}

package com.vpnbot.api.payment.exceptions;

/**
 * Thrown by getPayment, completePayment, failPayment and refundPayment operations in PaymentService.
 */
public class PaymentNotFoundException extends Exception {

    public PaymentNotFoundException(String message) {
        super(message);
    }
}

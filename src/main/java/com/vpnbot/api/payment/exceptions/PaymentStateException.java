package com.vpnbot.api.payment.exceptions;

/**
 * Thrown by completePayment, failPayment and refundPayment operations in PaymentService when the
 * payment's status doesn't allow the requested transition.
 */
public class PaymentStateException extends Exception {

    public PaymentStateException(String message) {
        super(message);
    }
}

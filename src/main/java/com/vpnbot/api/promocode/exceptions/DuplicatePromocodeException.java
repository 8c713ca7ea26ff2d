package com.vpnbot.api.promocode.exceptions;

/**
 * Thrown by createPromocode operation in PromocodeService when a promo code with the same code
 * already exists.
 */
public class DuplicatePromocodeException extends Exception {

    public DuplicatePromocodeException(String message) {
        super(message);
    }
}

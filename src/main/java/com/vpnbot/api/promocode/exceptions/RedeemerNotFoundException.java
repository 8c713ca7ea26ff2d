package com.vpnbot.api.promocode.exceptions;

/**
 * Thrown by redeemPromocode operation in PromocodeService when the user isn't registered.
 */
public class RedeemerNotFoundException extends Exception {

    public RedeemerNotFoundException(String message) {
        super(message);
    }
}

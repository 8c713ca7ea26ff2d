package com.vpnbot.api.promocode.exceptions;

/**
 * Thrown by redeemPromocode operation in PromocodeService when the promo code has reached its
 * usage limit.
 */
public class PromocodeExhaustedException extends PromocodeRedemptionException {

    public PromocodeExhaustedException(String message) {
        super(message);
    }
}

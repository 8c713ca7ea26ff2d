package com.vpnbot.api.promocode.exceptions;

/**
 * Thrown by redeemPromocode operation in PromocodeService when the promo code has expired.
 */
public class PromocodeExpiredException extends PromocodeRedemptionException {

    public PromocodeExpiredException(String message) {
        super(message);
    }
}

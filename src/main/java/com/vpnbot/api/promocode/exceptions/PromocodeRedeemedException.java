package com.vpnbot.api.promocode.exceptions;

/**
 * Thrown by redeemPromocode operation in PromocodeService when the user has already redeemed the
 * promo code.
 */
public class PromocodeRedeemedException extends PromocodeRedemptionException {

    public PromocodeRedeemedException(String message) {
        super(message);
    }
}

package com.vpnbot.api.promocode.exceptions;

/**
 * Thrown by operations in PromocodeService when a promo code with the given code doesn't exist, or
 * when a deactivated code is redeemed.
 */
public class PromocodeNotFoundException extends PromocodeRedemptionException {

    public PromocodeNotFoundException(String message) {
        super(message);
    }
}

package com.vpnbot.api.promocode.exceptions;

/**
 * Base class of the reasons a promo code can't be redeemed by a user.
 */
public abstract class PromocodeRedemptionException extends Exception {

    protected PromocodeRedemptionException(String message) {
        super(message);
    }
}

package com.vpnbot.api.contracts;

/**
 * Kinds of user-facing notifications. Each kind renders its own title and message.
 */
public enum NotificationKind {

    PAYMENT_SUCCEEDED(Level.SUCCESS),
    PAYMENT_RECEIVED(Level.WARNING),
    PROVISIONING_DELAYED(Level.WARNING),
    PROVISIONING_FAILED(Level.ERROR),
    ACCESS_RESTORED(Level.SUCCESS),
    SUBSCRIPTION_EXPIRING(Level.WARNING),
    SUBSCRIPTION_EXPIRED(Level.INFO),
    REFERRAL_BONUS(Level.SUCCESS),
    TRIAL_ACTIVATED(Level.SUCCESS),
    PROMOCODE_REDEEMED(Level.SUCCESS),
    ;

    private final Level level;

    NotificationKind(Level level) {
        this.level = level;
    }

    public Level getLevel() {
        return level;
    }

    public enum Level {
        INFO,
        WARNING,
        ERROR,
        SUCCESS,
    }
}

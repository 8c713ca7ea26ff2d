package com.vpnbot.api.notification;

import com.vpnbot.api.contracts.NotificationKind;
import lombok.NonNull;
import lombok.val;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the title and message of a notification from its kind and payload. Message templates
 * reference payload values as {@code {key}}; placeholders without a value render empty.
 */
class NotificationFormatter {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");
    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm xxx");
    private static final Map<NotificationKind, String[]> TEMPLATES = new EnumMap<>(NotificationKind.class);

    static {
        TEMPLATES.put(NotificationKind.PAYMENT_SUCCEEDED, new String[]{
            "Payment received",
            "Thank you! Your {planName} plan is active and your VPN access lasts until {endAt}.",
        });
        TEMPLATES.put(NotificationKind.PAYMENT_RECEIVED, new String[]{
            "Payment received",
            "Thank you! Your {planName} plan is paid and your access lasts until {endAt}. We couldn't " +
                "activate your VPN account; our support team has been alerted and will get back to you.",
        });
        TEMPLATES.put(NotificationKind.PROVISIONING_DELAYED, new String[]{
            "Activation in progress",
            "Your access is confirmed until {endAt}. We're still setting up your VPN account and will " +
                "activate it shortly.",
        });
        TEMPLATES.put(NotificationKind.PROVISIONING_FAILED, new String[]{
            "Activation failed",
            "We couldn't set up your VPN account. Your purchase is safe; our support team has been alerted " +
                "and will get back to you.",
        });
        TEMPLATES.put(NotificationKind.ACCESS_RESTORED, new String[]{
            "VPN access is ready",
            "Your VPN account is set up and active now.",
        });
        TEMPLATES.put(NotificationKind.SUBSCRIPTION_EXPIRING, new String[]{
            "Subscription ends soon",
            "Your subscription ends on {endAt}. Renew it to keep your VPN access.",
        });
        TEMPLATES.put(NotificationKind.SUBSCRIPTION_EXPIRED, new String[]{
            "Subscription ended",
            "Your subscription ended on {endAt} and your VPN access has been paused. Renew it any time.",
        });
        TEMPLATES.put(NotificationKind.REFERRAL_BONUS, new String[]{
            "Referral bonus",
            "A friend you invited made their first payment. You received {days} bonus days; your access " +
                "lasts until {endAt}.",
        });
        TEMPLATES.put(NotificationKind.TRIAL_ACTIVATED, new String[]{
            "Trial activated",
            "Your {days}-day trial is active until {endAt}.",
        });
        TEMPLATES.put(NotificationKind.PROMOCODE_REDEEMED, new String[]{
            "Promo code applied",
            "Promo code {code} added {days} days to your access, which now lasts until {endAt}.",
        });
    }

    private NotificationFormatter() {
    }

    @NonNull
    static String title(@NonNull NotificationKind kind) {
        return template(kind)[0];
    }

    @NonNull
    static String message(@NonNull NotificationKind kind, @NonNull Map<String, Object> payload) {
        val matcher = PLACEHOLDER.matcher(template(kind)[1]);
        val result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(format(payload.get(matcher.group(1)))));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * @return the plain text sent to the chat: the title, a blank line and the message.
     */
    @NonNull
    static String chatText(@NonNull NotificationKind kind, @NonNull Map<String, Object> payload) {
        return String.format("%s\n\n%s", title(kind), message(kind, payload));
    }

    @NonNull
    private static String[] template(@NonNull NotificationKind kind) {
        val template = TEMPLATES.get(kind);
        if (template == null) {
            throw new IllegalArgumentException("no template for notification kind " + kind);
        }

        return template;
    }

    @NonNull
    private static String format(Object value) {
        if (value == null) {
            return "";
        }

        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).format(DATE_TIME_FORMAT);
        }

        return value.toString();
    }
}

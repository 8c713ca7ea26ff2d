package com.vpnbot.api.vpn;

import lombok.NonNull;
import lombok.val;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;

/**
 * Derives panel usernames from user ids, e.g. {@code u42_9f86d081}. The suffix is the head of an
 * HMAC of the user id, so usernames don't reveal the ids of neighbouring users.
 */
class PanelUsernameGenerator {

    private static final String ALGORITHM = "HmacSHA256";
    private static final int SUFFIX_BYTES = 4;

    private final SecretKeySpec key;

    PanelUsernameGenerator(@NonNull String secret) {
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    /**
     * @param userId  id of the account owner.
     * @param attempt 1-indexed attempt number; attempts after the first get a distinguishing suffix.
     * @return a username made of lowercase letters, digits and underscores.
     */
    @NonNull
    String generate(long userId, int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive");
        }

        val digest = hmac(Long.toString(userId));
        val username = new StringBuilder("u").append(userId).append('_');
        for (int i = 0; i < SUFFIX_BYTES; i++) {
            username.append(String.format("%02x", digest[i]));
        }

        if (attempt > 1) {
            username.append('_').append(attempt);
        }

        return username.toString();
    }

    @NonNull
    private byte[] hmac(@NonNull String message) {
        try {
            val mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("failed to compute username digest", e);
        }
    }
}

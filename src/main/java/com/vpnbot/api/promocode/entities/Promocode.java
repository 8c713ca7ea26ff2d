package com.vpnbot.api.promocode.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code promocode} table in the database. A promo code
 * grants a number of access days to each user that redeems it.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Promocode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @NonNull
    @Builder.Default
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @Version
    private long version;

    @NonNull
    @Column(updatable = false, unique = true)
    private String code;

    @Column(updatable = false)
    private int days;

    /**
     * Maximum number of redemptions, or {@code 0} for an unlimited code.
     */
    private int usageLimit;

    private int usedCount;

    @Builder.Default
    private boolean isActive = true;

    private OffsetDateTime expiresAt;

    public boolean isExpiredAt(@NonNull OffsetDateTime at) {
        return expiresAt != null && !expiresAt.isAfter(at);
    }

    public boolean isExhausted() {
        return usageLimit > 0 && usedCount >= usageLimit;
    }
}

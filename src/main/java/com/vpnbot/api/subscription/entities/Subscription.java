package com.vpnbot.api.subscription.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code subscription} table in the database. A user's
 * <i>current</i> subscription is their active subscription with the latest {@link #endAt}.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

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

    @Column(updatable = false)
    private long userId;

    /**
     * The plan that opened this subscription; {@literal null} for trials and referral bonuses.
     */
    @ManyToOne
    private Plan plan;

    @NonNull
    private OffsetDateTime startAt;

    @NonNull
    private OffsetDateTime endAt;

    @Builder.Default
    private boolean isActive = true;

    /**
     * @return {@code true} if the subscription is active and {@code startAt <= at < endAt}.
     */
    public boolean isValidAt(@NonNull OffsetDateTime at) {
        return isActive && !startAt.isAfter(at) && endAt.isAfter(at);
    }
}

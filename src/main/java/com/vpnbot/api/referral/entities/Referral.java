package com.vpnbot.api.referral.entities;

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
 * A data access object that maps to the {@code referral} table in the database. A user is referred
 * at most once.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Referral {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Version
    private long version;

    @Column(updatable = false)
    private long referrerId;

    @Column(updatable = false, unique = true)
    private long refereeId;

    /**
     * When the referrer received their bonus; {@literal null} until the referee's first payment.
     */
    private OffsetDateTime creditedAt;

    private int bonusDays;
}

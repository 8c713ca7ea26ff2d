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
 * A data access object that maps to the {@code referral_link} table in the database. Each user
 * owns at most one link.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferralLink {

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

    @Column(updatable = false, unique = true)
    private long userId;

    @NonNull
    @Column(updatable = false, unique = true)
    private String code;

    @Builder.Default
    private boolean isActive = true;
}

package com.vpnbot.api.vpn.entities;

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
 * A data access object that maps to the {@code provisioning_failure} table in the database. A row
 * exists while the last provisioning of a user has failed, and is deleted by the next success.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProvisioningFailure {

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

    private int attempts;

    @Column(length = 1024)
    private String lastError;

    @NonNull
    private OffsetDateTime nextAttemptAt;

    /**
     * Permanent failures are never retried automatically; they need an operator.
     */
    private boolean isPermanent;
}

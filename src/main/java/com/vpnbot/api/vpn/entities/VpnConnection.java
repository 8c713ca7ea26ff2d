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
 * A data access object that maps to the {@code vpn_connection} table in the database. Each row
 * mirrors an account on the VPN panel; a user has at most one active connection.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VpnConnection {

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

    @NonNull
    @Column(updatable = false, unique = true)
    private String panelUsername;

    /**
     * Display name shown to the user.
     */
    private String name;

    @Builder.Default
    private boolean isActive = true;
}

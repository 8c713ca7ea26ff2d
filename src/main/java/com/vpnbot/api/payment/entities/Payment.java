package com.vpnbot.api.payment.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code payment} table in the database. Status transitions
 * are monotonic: {@code PENDING -> COMPLETED -> REFUNDED} or {@code PENDING -> FAILED}.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @NonNull
    private String id;

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
    @Column(updatable = false)
    private String planId;

    @NonNull
    @Column(updatable = false)
    private BigDecimal amount;

    @NonNull
    @Column(updatable = false)
    private String currency;

    /**
     * Payment method chosen by the user, e.g. {@code card}.
     */
    @NonNull
    @Column(updatable = false)
    private String method;

    private String description;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Status status = Status.PENDING;

    private OffsetDateTime completedAt;

    public enum Status {
        PENDING,
        COMPLETED,
        FAILED,
        REFUNDED,
    }
}

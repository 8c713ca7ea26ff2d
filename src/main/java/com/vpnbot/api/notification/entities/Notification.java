package com.vpnbot.api.notification.entities;

import com.vpnbot.api.contracts.NotificationKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code notification} table in the database. Rows are
 * never deleted; only {@link #isRead} changes after insertion.
 */
@Entity
@Table(uniqueConstraints = @UniqueConstraint(columnNames = {"userId", "kind", "referenceKey"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(updatable = false)
    private long userId;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private NotificationKind kind;

    @NonNull
    @Column(updatable = false)
    private String title;

    @NonNull
    @Column(updatable = false, length = 1024)
    private String message;

    /**
     * An optional idempotency marker, unique per user and kind.
     */
    @Column(updatable = false)
    private String referenceKey;

    private boolean isRead;
}

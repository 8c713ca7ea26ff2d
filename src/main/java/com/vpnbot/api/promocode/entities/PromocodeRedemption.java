package com.vpnbot.api.promocode.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * A data access object that maps to the {@code promocode_redemption} table in the database. A user
 * redeems each promo code at most once.
 */
@Entity
@Table(uniqueConstraints = @UniqueConstraint(columnNames = {"promocodeId", "userId"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromocodeRedemption {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(updatable = false)
    private long promocodeId;

    @Column(updatable = false)
    private long userId;

    @Column(updatable = false)
    private int days;
}

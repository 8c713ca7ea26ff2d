package com.vpnbot.api.promocode.entities;

import jakarta.persistence.LockModeType;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Promocode} entity.
 */
@Repository
public interface PromocodeRepository extends CrudRepository<Promocode, Long> {

    @NonNull
    @Transactional(readOnly = true)
    Optional<Promocode> findByCode(@NonNull String code);

    @Transactional(readOnly = true)
    boolean existsByCode(@NonNull String code);

    /**
     * Reads a promo code while holding an exclusive row lock until the end of the ongoing
     * transaction, so that its redemptions are counted one after another.
     */
    @NonNull
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Promocode e where e.code = ?1")
    Optional<Promocode> findWithLockByCode(@NonNull String code);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Promocode e where e.isActive = true order by e.createdAt desc")
    List<Promocode> findAllActive();
}

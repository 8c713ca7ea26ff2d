package com.vpnbot.api.referral.entities;

import jakarta.persistence.LockModeType;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Referral} entity.
 */
@Repository
public interface ReferralRepository extends CrudRepository<Referral, Long> {

    /**
     * Reads the referral of a referee while holding an exclusive row lock until the end of the
     * ongoing transaction.
     */
    @NonNull
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Referral e where e.refereeId = ?1")
    Optional<Referral> findWithLockByRefereeId(long refereeId);

    @Transactional(readOnly = true)
    boolean existsByRefereeId(long refereeId);

    @Transactional(readOnly = true)
    long countByReferrerId(long referrerId);

    @Transactional(readOnly = true)
    @Query("select count(e) from Referral e where e.referrerId = ?1 and e.creditedAt is not null")
    long countCreditedByReferrerId(long referrerId);

    /**
     * @return total bonus days the referrer has received.
     */
    @Transactional(readOnly = true)
    @Query("select coalesce(sum(e.bonusDays), 0) from Referral e where e.referrerId = ?1 and e.creditedAt is not null")
    long sumBonusDaysByReferrerId(long referrerId);
}

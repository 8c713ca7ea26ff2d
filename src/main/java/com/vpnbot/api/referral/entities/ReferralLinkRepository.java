package com.vpnbot.api.referral.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link ReferralLink} entity.
 */
@Repository
public interface ReferralLinkRepository extends CrudRepository<ReferralLink, Long> {

    @NonNull
    @Transactional(readOnly = true)
    Optional<ReferralLink> findByUserId(long userId);

    @Transactional(readOnly = true)
    boolean existsByCode(@NonNull String code);

    /**
     * @return the link with the given code, unless its owner has deactivated it.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from ReferralLink e where e.code = ?1 and e.isActive = true")
    Optional<ReferralLink> findActiveByCode(@NonNull String code);
}

package com.vpnbot.api.vpn.entities;

import lombok.NonNull;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link ProvisioningFailure}
 * entity.
 */
@Repository
public interface ProvisioningFailureRepository extends CrudRepository<ProvisioningFailure, Long> {

    @NonNull
    @Transactional(readOnly = true)
    Optional<ProvisioningFailure> findByUserId(long userId);

    /**
     * @return ids of users whose retryable failure is due at the given instant, oldest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.userId from ProvisioningFailure e where e.isPermanent = false and e.nextAttemptAt <= ?1 " +
        "order by e.nextAttemptAt asc")
    List<Long> findAllDueUserIds(@NonNull OffsetDateTime now, @NonNull Pageable pageable);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.userId from ProvisioningFailure e")
    List<Long> findAllUserIds();
}

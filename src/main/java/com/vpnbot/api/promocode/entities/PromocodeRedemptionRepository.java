package com.vpnbot.api.promocode.entities;

import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link PromocodeRedemption}
 * entity.
 */
@Repository
public interface PromocodeRedemptionRepository extends CrudRepository<PromocodeRedemption, Long> {

    @Transactional(readOnly = true)
    boolean existsByPromocodeIdAndUserId(long promocodeId, long userId);
}

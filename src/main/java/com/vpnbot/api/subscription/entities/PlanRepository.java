package com.vpnbot.api.subscription.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Plan} entity.
 */
@Repository
public interface PlanRepository extends CrudRepository<Plan, String> {

    @NonNull
    @Override
    default <S extends Plan> S save(@NonNull S entity) {
        throw new UnsupportedOperationException("plan entities don't support updates");
    }

    @NonNull
    @Override
    default <S extends Plan> Iterable<S> saveAll(@NonNull Iterable<S> entities) {
        throw new UnsupportedOperationException("plan entities don't support updates");
    }

    @Override
    default void delete(@NonNull Plan entity) {
        throw new UnsupportedOperationException("plan entities don't support deletes");
    }

    @Override
    default void deleteById(@NonNull String id) {
        throw new UnsupportedOperationException("plan entities don't support deletes");
    }

    /**
     * @return a non-null list of plans on sale, cheapest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Plan e where e.isActive = true order by e.price asc, e.durationDays asc")
    List<Plan> findAllActive();

    /**
     * @param id id of the plan.
     * @return the plan if it exists and is on sale.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Plan e where e.id = ?1 and e.isActive = true")
    Optional<Plan> findActiveById(@NonNull String id);
}

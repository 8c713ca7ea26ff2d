package com.vpnbot.api.subscription.entities;

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
 * A JPA {@link Repository} declaration for database interactions of {@link Subscription} entity.
 */
@Repository
public interface SubscriptionRepository extends CrudRepository<Subscription, Long> {

    /**
     * Retrieves all active subscriptions of a user, ordered by {@code endAt} (latest first). The
     * first element, if any, is the user's current subscription.
     *
     * @param userId id of the subscription owner.
     * @return a guaranteed to be not {@literal null} list of {@link Subscription} instances.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.userId = ?1 and e.isActive = true order by e.endAt desc, e.id desc")
    List<Subscription> findAllActiveByUserId(long userId);

    /**
     * @param userId id of the subscription owner.
     * @return the user's current subscription, i.e. the active one with the latest {@code endAt}.
     */
    @NonNull
    default Optional<Subscription> findCurrentByUserId(long userId) {
        return findAllActiveByUserId(userId).stream().findFirst();
    }

    /**
     * Checks whether a valid subscription ({@code isActive && startAt <= at < endAt}) exists for the
     * given {@code userId}.
     */
    @Transactional(readOnly = true)
    @Query("select case when count(e) > 0 then true else false end from Subscription e where " +
        "e.userId = ?1 and e.isActive = true and e.startAt <= ?2 and e.endAt > ?2")
    boolean existsValidByUserId(long userId, @NonNull OffsetDateTime at);

    /**
     * @return ids of all users that own a valid subscription at the given instant.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select distinct e.userId from Subscription e where e.isActive = true and e.startAt <= ?1 and e.endAt > ?1")
    List<Long> findAllUserIdsWithValidSubscription(@NonNull OffsetDateTime at);

    /**
     * Retrieves active subscriptions whose access window has closed, i.e. {@code endAt <= at}.
     *
     * @param at       the instant to compare against.
     * @param pageable limits the size of a single sweep batch.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.isActive = true and e.endAt <= ?1 order by e.endAt asc")
    List<Subscription> findAllActiveEndedBefore(@NonNull OffsetDateTime at, @NonNull Pageable pageable);

    /**
     * Retrieves active subscriptions whose access window closes in {@code (from, to]}.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.isActive = true and e.endAt > ?1 and e.endAt <= ?2 order by e.endAt asc")
    List<Subscription> findAllActiveEndingBetween(@NonNull OffsetDateTime from, @NonNull OffsetDateTime to, @NonNull Pageable pageable);
}

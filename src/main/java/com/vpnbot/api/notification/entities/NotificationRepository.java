package com.vpnbot.api.notification.entities;

import com.vpnbot.api.contracts.NotificationKind;
import lombok.NonNull;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Notification} entity.
 */
@Repository
public interface NotificationRepository extends CrudRepository<Notification, Long> {

    /**
     * Checks whether a notification with the given idempotency marker was already recorded.
     */
    @Transactional(readOnly = true)
    @Query("select case when count(e) > 0 then true else false end from Notification e where " +
        "e.userId = ?1 and e.kind = ?2 and e.referenceKey = ?3")
    boolean existsByReference(long userId, @NonNull NotificationKind kind, @NonNull String referenceKey);

    /**
     * Retrieves a {@code page} of a user's notifications, newest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Notification e where e.userId = ?1 order by e.createdAt desc, e.id desc")
    List<Notification> findAllByUserId(long userId, @NonNull Pageable pageable);

    /**
     * Retrieves a {@code page} of a user's unread notifications, newest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Notification e where e.userId = ?1 and e.isRead = false order by e.createdAt desc, e.id desc")
    List<Notification> findAllUnreadByUserId(long userId, @NonNull Pageable pageable);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Notification e where e.id = ?1 and e.userId = ?2")
    Optional<Notification> findByIdAndUserId(long id, long userId);

    /**
     * Marks all unread notifications of a user as read.
     *
     * @return the number of notifications that changed.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update Notification e set e.isRead = true where e.userId = ?1 and e.isRead = false")
    int markAllReadByUserId(long userId);
}

package com.vpnbot.api.payment.entities;

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
 * A JPA {@link Repository} declaration for database interactions of {@link Payment} entity.
 */
@Repository
public interface PaymentRepository extends CrudRepository<Payment, String> {

    /**
     * Reads a payment while holding an exclusive row lock until the end of the ongoing
     * transaction. Concurrent completions of the same payment serialize on this lock.
     */
    @NonNull
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Payment e where e.id = ?1")
    Optional<Payment> findWithLockById(@NonNull String id);

    /**
     * @return ids of the user's payments in the given status, oldest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.id from Payment e where e.userId = ?1 and e.status = ?2 order by e.createdAt asc, e.id asc")
    List<String> findAllIdsByUserIdAndStatus(long userId, @NonNull Payment.Status status);

    @NonNull
    default List<String> findAllCompletedIdsByUserId(long userId) {
        return findAllIdsByUserIdAndStatus(userId, Payment.Status.COMPLETED);
    }
}

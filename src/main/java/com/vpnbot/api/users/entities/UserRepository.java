package com.vpnbot.api.users.entities;

import jakarta.persistence.LockModeType;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link User} entity.
 */
@Repository
public interface UserRepository extends CrudRepository<User, Long> {

    /**
     * Reads a user while holding an exclusive row lock until the end of the ongoing transaction.
     *
     * @param id platform id of the user.
     * @return an optional {@link User} entity.
     */
    @NonNull
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from User e where e.id = ?1")
    Optional<User> findWithLockById(long id);
}

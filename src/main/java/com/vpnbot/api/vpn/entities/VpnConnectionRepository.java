package com.vpnbot.api.vpn.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link VpnConnection} entity.
 */
@Repository
public interface VpnConnectionRepository extends JpaRepository<VpnConnection, Long> {

    /**
     * @return a guaranteed to be not {@literal null} list of the user's active connections. A
     * consistent ledger never returns more than one.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from VpnConnection e where e.userId = ?1 and e.isActive = true order by e.id asc")
    List<VpnConnection> findAllActiveByUserId(long userId);

    /**
     * @return the user's most recently created connection, active or not.
     */
    @NonNull
    @Transactional(readOnly = true)
    Optional<VpnConnection> findFirstByUserIdOrderByIdDesc(long userId);

    @NonNull
    @Transactional(readOnly = true)
    Optional<VpnConnection> findByPanelUsername(@NonNull String panelUsername);

    /**
     * @return ids of all users that have an active connection.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select distinct e.userId from VpnConnection e where e.isActive = true")
    List<Long> findAllActiveUserIds();
}

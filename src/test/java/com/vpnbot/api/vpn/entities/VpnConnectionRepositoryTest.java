package com.vpnbot.api.vpn.entities;

import lombok.val;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
public class VpnConnectionRepositoryTest {

    @Autowired
    private VpnConnectionRepository connectionRepository;

    @Test
    void findFirstByUserIdOrderByIdDesc() {
        save(1, "u1_a", false);
        val latest = save(1, "u1_b", false);
        save(2, "u2_a", true);

        val result = connectionRepository.findFirstByUserIdOrderByIdDesc(1);
        assertTrue(result.isPresent());
        assertEquals(latest.getId(), result.get().getId());
        assertTrue(connectionRepository.findFirstByUserIdOrderByIdDesc(3).isEmpty());
    }

    @Test
    void findAllActiveByUserId() {
        save(1, "u1_a", false);
        val active = save(1, "u1_b", true);

        val result = connectionRepository.findAllActiveByUserId(1);
        assertEquals(1, result.size());
        assertEquals(active.getId(), result.get(0).getId());
    }

    @Test
    void findAllActiveUserIds() {
        save(1, "u1_a", true);
        save(2, "u2_a", false);
        save(3, "u3_a", true);

        assertEquals(Set.of(1L, 3L), Set.copyOf(connectionRepository.findAllActiveUserIds()));
        assertTrue(connectionRepository.findByPanelUsername("u2_a").isPresent());
        assertTrue(connectionRepository.findByPanelUsername("u4_a").isEmpty());
    }

    private VpnConnection save(long userId, String panelUsername, boolean isActive) {
        return connectionRepository.save(
            VpnConnection.builder()
                .userId(userId)
                .panelUsername(panelUsername)
                .name("VPN " + userId)
                .isActive(isActive)
                .build());
    }
}

package com.vpnbot.api.vpn.entities;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
public class ProvisioningFailureRepositoryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private ProvisioningFailureRepository failureRepository;

    @Test
    void findAllDueUserIds() {
        save(1, NOW.minusMinutes(5), false);
        save(2, NOW, false);
        save(3, NOW.plusMinutes(5), false);
        save(4, NOW.minusMinutes(10), true);

        assertEquals(List.of(1L, 2L), failureRepository.findAllDueUserIds(NOW, PageRequest.of(0, 10)));
        assertEquals(List.of(1L), failureRepository.findAllDueUserIds(NOW, PageRequest.of(0, 1)));
        assertEquals(Set.of(1L, 2L, 3L, 4L), Set.copyOf(failureRepository.findAllUserIds()));
    }

    private void save(long userId, OffsetDateTime nextAttemptAt, boolean isPermanent) {
        failureRepository.save(
            ProvisioningFailure.builder()
                .userId(userId)
                .attempts(1)
                .nextAttemptAt(nextAttemptAt)
                .isPermanent(isPermanent)
                .build());
    }
}

package com.vpnbot.api.vpn;

import com.vpnbot.api.contracts.ProvisioningStatus;
import com.vpnbot.api.contracts.SubscriptionServiceContract;
import com.vpnbot.api.contracts.VpnServiceContract;
import com.vpnbot.api.notification.NotificationDispatcher;
import com.vpnbot.api.platform.transaction.UnitOfWork;
import com.vpnbot.api.users.entities.User;
import com.vpnbot.api.vpn.upstream.VpnProvisioner;
import jakarta.persistence.EntityManager;
import lombok.val;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Provisions the same user from several threads at once, each in its own committed transaction.
 */
@SpringBootTest
@ActiveProfiles("test")
public class VpnConcurrencyTest {

    private static final long USER_ID = 201L;
    private static final int THREADS = 4;

    @MockBean
    private VpnProvisioner vpnProvisioner;

    @MockBean
    private NotificationDispatcher notificationDispatcher;

    @Autowired
    private VpnServiceContract vpnServiceContract;

    @Autowired
    private SubscriptionServiceContract subscriptionServiceContract;

    @Autowired
    private UnitOfWork unitOfWork;

    @Autowired
    private EntityManager entityManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        unitOfWork.run(() -> {
            entityManager.merge(User.builder().id(USER_ID).username("alice").build());
            subscriptionServiceContract.grantDays(USER_ID, 30, OffsetDateTime.now());
        });
    }

    @AfterEach
    void tearDown() {
        for (val table : List.of("notification", "provisioning_failure", "vpn_connection", "subscription", "users")) {
            jdbcTemplate.update("delete from " + table);
        }
    }

    @Test
    void provision_withConcurrentCalls() throws Exception {
        // keeps the first call inside the panel while the others arrive.
        doAnswer(invocation -> {
            Thread.sleep(200);
            return null;
        }).when(vpnProvisioner).createAccount(anyString());

        val start = new CountDownLatch(1);
        val executor = Executors.newFixedThreadPool(THREADS);
        try {
            val futures = new ArrayList<Future<ProvisioningStatus>>();
            for (int i = 0; i < THREADS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return vpnServiceContract.provision(USER_ID);
                }));
            }

            start.countDown();
            for (val future : futures) {
                assertEquals(ProvisioningStatus.PROVISIONED, future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        verify(vpnProvisioner, times(1)).createAccount(anyString());
        assertEquals(1, jdbcTemplate.queryForObject(
            "select count(*) from vpn_connection where user_id = ?", Integer.class, USER_ID));
        assertEquals(0, jdbcTemplate.queryForObject(
            "select count(*) from provisioning_failure where user_id = ?", Integer.class, USER_ID));
    }
}

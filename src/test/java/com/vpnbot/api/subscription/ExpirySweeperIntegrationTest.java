package com.vpnbot.api.subscription;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.notification.NotificationDispatcher;
import com.vpnbot.api.payment.payload.CreatePaymentParams;
import com.vpnbot.api.payment.payload.PaymentResponse;
import com.vpnbot.api.platform.transaction.UnitOfWork;
import com.vpnbot.api.subscription.entities.Plan;
import com.vpnbot.api.subscription.entities.SubscriptionRepository;
import com.vpnbot.api.users.entities.User;
import com.vpnbot.api.vpn.exceptions.PanelUnavailableException;
import com.vpnbot.api.vpn.upstream.VpnProvisioner;
import jakarta.persistence.EntityManager;
import lombok.val;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs a paid purchase whose provisioning is deferred through a committed sweep.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class ExpirySweeperIntegrationTest {

    private static final long USER_ID = 301L;

    @Value("${app.payments.webhook-secret}")
    private String webhookSecret;

    @MockBean
    private VpnProvisioner vpnProvisioner;

    @MockBean
    private NotificationDispatcher notificationDispatcher;

    @Autowired
    private ExpirySweeper sweeper;

    @Autowired
    private SubscriptionRepository subscriptionRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MockMvc mockMvc;

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
            entityManager.merge(
                Plan.builder()
                    .id("test-month")
                    .name("1 month")
                    .price(new BigDecimal("199.00"))
                    .currency("RUB")
                    .durationDays(30)
                    .build());
        });
    }

    @AfterEach
    void tearDown() {
        for (val table : List.of(
            "notification", "provisioning_failure", "vpn_connection", "payment", "subscription", "plan", "users")) {
            jdbcTemplate.update("delete from " + table);
        }
    }

    @Test
    void sweep_retriesDeferredProvisioningOfPaidAccess() throws Exception {
        doThrow(new PanelUnavailableException("panel is down", null))
            .when(vpnProvisioner).createAccount(anyString());

        val paymentId = createPayment();
        mockMvc.perform(post("/v1/payments/" + paymentId + "/complete")
                .header("X-Webhook-Secret", webhookSecret))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.provisioning").value("DEFERRED"));

        val endAt = subscriptionRepository.findCurrentByUserId(USER_ID).orElseThrow().getEndAt();
        assertEquals(1, jdbcTemplate.queryForObject(
            "select count(*) from provisioning_failure where user_id = ?", Integer.class, USER_ID));

        // the panel is back and the backoff has elapsed.
        reset(vpnProvisioner);
        jdbcTemplate.update(
            "update provisioning_failure set next_attempt_at = ? where user_id = ?",
            OffsetDateTime.now().minusMinutes(1), USER_ID);

        val report = sweeper.sweep().orElseThrow();
        assertEquals(1, report.getRetried());
        assertEquals(0, report.getFailed());
        assertEquals(0, report.getExpired());

        val current = subscriptionRepository.findCurrentByUserId(USER_ID).orElseThrow();
        assertTrue(current.isActive());
        assertTrue(endAt.isEqual(current.getEndAt()));
        assertEquals(0, jdbcTemplate.queryForObject(
            "select count(*) from provisioning_failure where user_id = ?", Integer.class, USER_ID));

        mockMvc.perform(get("/v1/vpn/" + USER_ID))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.isActive").value(true))
            .andExpect(jsonPath("$.isProvisioningPending").value(false));

        verify(vpnProvisioner, times(1)).createAccount(anyString());
        verify(notificationDispatcher).notify(eq(USER_ID), eq(NotificationKind.PROVISIONING_DELAYED), any());
        verify(notificationDispatcher).notify(eq(USER_ID), eq(NotificationKind.ACCESS_RESTORED), any());

        // a second sweep finds nothing to do.
        val rerun = sweeper.sweep().orElseThrow();
        assertEquals(0, rerun.getRetried() + rerun.getRepaired() + rerun.getFailed());
        assertTrue(endAt.isEqual(subscriptionRepository.findCurrentByUserId(USER_ID).orElseThrow().getEndAt()));
    }

    private String createPayment() throws Exception {
        val result = mockMvc.perform(post("/v1/payments")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new CreatePaymentParams(USER_ID, "test-month", "card"))))
            .andExpect(status().isCreated())
            .andReturn();

        return objectMapper.readValue(result.getResponse().getContentAsByteArray(), PaymentResponse.class).getId();
    }
}

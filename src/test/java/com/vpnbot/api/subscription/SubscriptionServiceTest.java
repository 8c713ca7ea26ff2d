package com.vpnbot.api.subscription;

import com.vpnbot.api.contracts.UserServiceContract;
import com.vpnbot.api.subscription.entities.Plan;
import com.vpnbot.api.subscription.entities.PlanRepository;
import com.vpnbot.api.subscription.entities.Subscription;
import com.vpnbot.api.subscription.entities.SubscriptionRepository;
import com.vpnbot.api.subscription.exceptions.PlanNotFoundException;
import com.vpnbot.api.subscription.exceptions.SubscriptionNotFoundException;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubscriptionServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private SubscriptionConfiguration subscriptionConfig;

    @Mock
    private PlanRepository planRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private UserServiceContract userServiceContract;

    private OffsetDateTime now;
    private SubscriptionService service;

    @BeforeEach
    void setUp() {
        val clock = Clock.fixed(NOW, ZoneOffset.UTC);
        now = OffsetDateTime.now(clock);
        lenient().when(userServiceContract.lockUser(1L)).thenReturn(true);
        lenient().when(subscriptionRepository.save(any())).thenAnswer(i -> i.getArgument(0));
        service = new SubscriptionService(subscriptionConfig, planRepository, subscriptionRepository, userServiceContract, clock);
    }

    @ParameterizedTest(name = "{displayName} - policy={0} currentEndOffsetDays={1}")
    @MethodSource("grantAccessTestCases")
    void grantAccess(
        SubscriptionConfiguration.RenewalPolicy policy,
        Integer currentEndOffsetDays,
        int expectedEndOffsetDays,
        boolean expectNewWindow
    ) throws PlanNotFoundException {
        val plan = buildPlan("month", 30);
        lenient().when(subscriptionConfig.getRenewalPolicy()).thenReturn(policy);
        when(planRepository.findById(plan.getId())).thenReturn(Optional.of(plan));

        Subscription current = null;
        if (currentEndOffsetDays != null) {
            current = buildSubscription(now.minusDays(10), now.plusDays(currentEndOffsetDays));
        }

        when(subscriptionRepository.findCurrentByUserId(1L)).thenReturn(Optional.ofNullable(current));

        val endAt = service.grantAccess(1L, plan.getId(), now);
        assertTrue(now.plusDays(expectedEndOffsetDays).isEqual(endAt));

        val captor = ArgumentCaptor.forClass(Subscription.class);
        verify(subscriptionRepository).save(captor.capture());
        val saved = captor.getValue();
        assertEquals(plan, saved.getPlan());
        assertTrue(saved.isActive());
        if (expectNewWindow) {
            assertTrue(now.isEqual(saved.getStartAt()));
            assertEquals(0L, saved.getId());
        } else {
            assertEquals(current, saved);
        }
    }

    static Stream<Arguments> grantAccessTestCases() {
        return Stream.of(
            // policy, current subscription end offset, expected end offset, expect new window
            arguments(SubscriptionConfiguration.RenewalPolicy.STACK, null, 30, true),
            arguments(SubscriptionConfiguration.RenewalPolicy.STACK, 5, 35, false),
            arguments(SubscriptionConfiguration.RenewalPolicy.STACK, -1, 30, true),
            arguments(SubscriptionConfiguration.RenewalPolicy.STACK, 0, 30, true),
            arguments(SubscriptionConfiguration.RenewalPolicy.RESET, 5, 30, false),
            arguments(SubscriptionConfiguration.RenewalPolicy.RESET, -1, 30, true)
        );
    }

    @Test
    void grantAccess_withUnknownPlan() {
        when(planRepository.findById("unknown")).thenReturn(Optional.empty());
        assertThrows(PlanNotFoundException.class, () -> service.grantAccess(1L, "unknown", now));
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    void grantDays_withUnknownUser() {
        when(userServiceContract.lockUser(2L)).thenReturn(false);
        assertThrows(IllegalArgumentException.class, () -> service.grantDays(2L, 7, now));
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    void grantDays_keepsPlanOfCurrentWindow() {
        val plan = buildPlan("month", 30);
        val current = buildSubscription(now.minusDays(10), now.plusDays(20));
        current.setPlan(plan);
        when(subscriptionConfig.getRenewalPolicy()).thenReturn(SubscriptionConfiguration.RenewalPolicy.STACK);
        when(subscriptionRepository.findCurrentByUserId(1L)).thenReturn(Optional.of(current));

        val endAt = service.grantDays(1L, 7, now);
        assertTrue(now.plusDays(27).isEqual(endAt));
        assertEquals(plan, current.getPlan());
    }

    @Test
    void grantDays_withNonPositiveDays() {
        assertThrows(IllegalArgumentException.class, () -> service.grantDays(1L, 0, now));
    }

    @Test
    void quotePlan() throws PlanNotFoundException {
        val plan = buildPlan("quarter", 90);
        when(planRepository.findActiveById(plan.getId())).thenReturn(Optional.of(plan));
        when(planRepository.findActiveById("retired")).thenReturn(Optional.empty());

        val quote = service.quotePlan(plan.getId());
        assertEquals(plan.getPrice(), quote.getPrice());
        assertEquals(plan.getCurrency(), quote.getCurrency());
        assertEquals(90, quote.getDurationDays());
        assertThrows(PlanNotFoundException.class, () -> service.quotePlan("retired"));
    }

    @Test
    void getCurrentSubscription() throws SubscriptionNotFoundException {
        val subscription = buildSubscription(now.minusDays(1), now.plusDays(3).plusHours(5));
        when(subscriptionRepository.findCurrentByUserId(1L)).thenReturn(Optional.of(subscription));
        when(subscriptionRepository.findCurrentByUserId(2L)).thenReturn(Optional.empty());

        val response = service.getCurrentSubscription(1L);
        assertTrue(response.getIsValid());
        assertEquals(3L, response.getDaysRemaining());
        assertNull(response.getPlan());
        assertThrows(SubscriptionNotFoundException.class, () -> service.getCurrentSubscription(2L));
    }

    @Test
    void listPlans() {
        when(planRepository.findAllActive()).thenReturn(List.of(buildPlan("month", 30), buildPlan("year", 365)));

        val plans = service.listPlans();
        assertEquals(2, plans.size());
        assertEquals("month", plans.get(0).getId());
        assertEquals(365, plans.get(1).getDurationDays());
    }

    @NonNull
    private static Plan buildPlan(@NonNull String id, int durationDays) {
        return Plan.builder()
            .id(id)
            .name(id)
            .price(BigDecimal.valueOf(199))
            .currency("RUB")
            .durationDays(durationDays)
            .build();
    }

    @NonNull
    private static Subscription buildSubscription(@NonNull OffsetDateTime startAt, @NonNull OffsetDateTime endAt) {
        return Subscription.builder()
            .id(10L)
            .userId(1L)
            .startAt(startAt)
            .endAt(endAt)
            .build();
    }
}

package com.vpnbot.api.subscription;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.contracts.NotificationServiceContract;
import com.vpnbot.api.contracts.ProvisioningStatus;
import com.vpnbot.api.contracts.VpnServiceContract;
import com.vpnbot.api.platform.transaction.UnitOfWork;
import com.vpnbot.api.subscription.entities.Subscription;
import com.vpnbot.api.subscription.entities.SubscriptionRepository;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExpirySweeperTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private SubscriptionConfiguration subscriptionConfig;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private VpnServiceContract vpnServiceContract;

    @Mock
    private NotificationServiceContract notificationServiceContract;

    private OffsetDateTime now;
    private ExpirySweeper sweeper;

    @BeforeEach
    void setUp() {
        val clock = Clock.fixed(NOW, ZoneOffset.UTC);
        now = OffsetDateTime.now(clock);

        lenient().when(subscriptionConfig.getSweepBatchSize()).thenReturn(100);
        lenient().when(subscriptionConfig.getExpiryWarningWindow()).thenReturn(Duration.ofHours(24));
        lenient().when(subscriptionRepository.findAllActiveEndedBefore(any(), any())).thenReturn(List.of());
        lenient().when(subscriptionRepository.findAllActiveEndingBetween(any(), any(), any())).thenReturn(List.of());
        lenient().when(subscriptionRepository.findAllUserIdsWithValidSubscription(any())).thenReturn(List.of());
        lenient().when(vpnServiceContract.findUsersDueForRetry(any(), anyInt())).thenReturn(List.of());
        lenient().when(vpnServiceContract.findUsersWithActiveConnection()).thenReturn(Set.of());
        lenient().when(vpnServiceContract.findUsersWithProvisioningFailure()).thenReturn(Set.of());
        lenient().when(vpnServiceContract.provision(anyLong())).thenReturn(ProvisioningStatus.PROVISIONED);

        val unitOfWork = new UnitOfWork(mock(PlatformTransactionManager.class));
        sweeper = new ExpirySweeper(
            subscriptionConfig,
            subscriptionRepository,
            vpnServiceContract,
            notificationServiceContract,
            unitOfWork,
            clock);
    }

    @Test
    void sweep_expiresEndedSubscriptionOnce() {
        val subscription = buildSubscription(5L, 1L, now.minusSeconds(1));
        when(subscriptionRepository.findAllActiveEndedBefore(eq(now), any())).thenReturn(List.of(subscription));
        when(subscriptionRepository.findById(5L)).thenReturn(Optional.of(subscription));
        when(subscriptionRepository.existsValidByUserId(1L, now)).thenReturn(false);
        when(notificationServiceContract.record(eq(1L), eq(NotificationKind.SUBSCRIPTION_EXPIRED), any(), any()))
            .thenReturn(true);

        val report = sweeper.sweep();
        assertTrue(report.isPresent());
        assertEquals(1, report.get().getExpired());
        assertFalse(subscription.isActive());
        verify(subscriptionRepository).save(subscription);
        verify(vpnServiceContract).provision(1L);
        verify(notificationServiceContract).record(
            eq(1L),
            eq(NotificationKind.SUBSCRIPTION_EXPIRED),
            eq("subscription:5:" + subscription.getEndAt().toEpochSecond()),
            any());
        verify(notificationServiceContract).dispatch(eq(1L), eq(NotificationKind.SUBSCRIPTION_EXPIRED), any());

        // the same row, if listed again, is already inactive.
        val rerun = sweeper.sweep();
        assertTrue(rerun.isPresent());
        assertEquals(0, rerun.get().getExpired());
        verify(vpnServiceContract, times(1)).provision(1L);
        verify(notificationServiceContract, times(1)).dispatch(eq(1L), eq(NotificationKind.SUBSCRIPTION_EXPIRED), any());
    }

    @Test
    void sweep_doesNotNotifyWhenAnotherWindowIsValid() {
        val subscription = buildSubscription(5L, 1L, now.minusSeconds(1));
        when(subscriptionRepository.findAllActiveEndedBefore(eq(now), any())).thenReturn(List.of(subscription));
        when(subscriptionRepository.findById(5L)).thenReturn(Optional.of(subscription));
        when(subscriptionRepository.existsValidByUserId(1L, now)).thenReturn(true);

        val report = sweeper.sweep();
        assertTrue(report.isPresent());
        assertEquals(1, report.get().getExpired());
        verify(vpnServiceContract).provision(1L);
        verify(notificationServiceContract, never()).record(anyLong(), any(), any(), any());
        verify(notificationServiceContract, never()).dispatch(anyLong(), any(), any());
    }

    @Test
    void sweep_continuesAfterFailedItem() {
        val broken = buildSubscription(5L, 1L, now.minusHours(1));
        val healthy = buildSubscription(6L, 2L, now.minusSeconds(1));
        when(subscriptionRepository.findAllActiveEndedBefore(eq(now), any())).thenReturn(List.of(broken, healthy));
        when(subscriptionRepository.findById(5L)).thenThrow(new IllegalStateException("test"));
        when(subscriptionRepository.findById(6L)).thenReturn(Optional.of(healthy));
        when(subscriptionRepository.existsValidByUserId(2L, now)).thenReturn(false);
        when(notificationServiceContract.record(eq(2L), any(), any(), any())).thenReturn(true);

        val report = sweeper.sweep();
        assertTrue(report.isPresent());
        assertEquals(1, report.get().getExpired());
        assertEquals(1, report.get().getFailed());
        verify(vpnServiceContract).provision(2L);
    }

    @Test
    void sweep_sendsRecordedExpiryWhenProvisioningThrows() {
        val subscription = buildSubscription(5L, 1L, now.minusSeconds(1));
        when(subscriptionRepository.findAllActiveEndedBefore(eq(now), any())).thenReturn(List.of(subscription));
        when(subscriptionRepository.findById(5L)).thenReturn(Optional.of(subscription));
        when(subscriptionRepository.existsValidByUserId(1L, now)).thenReturn(false);
        when(notificationServiceContract.record(eq(1L), eq(NotificationKind.SUBSCRIPTION_EXPIRED), any(), any()))
            .thenReturn(true);
        when(vpnServiceContract.provision(1L)).thenThrow(new IllegalStateException("test"));

        val report = sweeper.sweep().orElseThrow();
        assertEquals(1, report.getFailed());
        assertFalse(subscription.isActive());
        verify(notificationServiceContract).dispatch(eq(1L), eq(NotificationKind.SUBSCRIPTION_EXPIRED), any());
    }

    @Test
    void sweep_warnsOnlyAboutCurrentSubscriptions() {
        val current = buildSubscription(5L, 1L, now.plusHours(3));
        val superseded = buildSubscription(6L, 2L, now.plusHours(5));
        val later = buildSubscription(7L, 2L, now.plusDays(30));
        when(subscriptionRepository.findAllActiveEndingBetween(eq(now), eq(now.plusHours(24)), any()))
            .thenReturn(List.of(current, superseded));
        when(subscriptionRepository.findCurrentByUserId(1L)).thenReturn(Optional.of(current));
        when(subscriptionRepository.findCurrentByUserId(2L)).thenReturn(Optional.of(later));
        when(notificationServiceContract.record(eq(1L), eq(NotificationKind.SUBSCRIPTION_EXPIRING), any(), any()))
            .thenReturn(true)
            .thenReturn(false);

        assertEquals(1, sweeper.sweep().orElseThrow().getWarned());
        verify(notificationServiceContract).dispatch(eq(1L), eq(NotificationKind.SUBSCRIPTION_EXPIRING), any());
        verify(notificationServiceContract, never()).record(eq(2L), any(), any(), any());

        // already warned about this window.
        assertEquals(0, sweeper.sweep().orElseThrow().getWarned());
        verify(notificationServiceContract, times(1)).dispatch(eq(1L), eq(NotificationKind.SUBSCRIPTION_EXPIRING), any());
    }

    @Test
    void sweep_retriesDueProvisioningFailures() {
        when(vpnServiceContract.findUsersDueForRetry(now, 100)).thenReturn(List.of(3L, 4L));
        when(vpnServiceContract.provision(4L)).thenReturn(ProvisioningStatus.DEFERRED);

        val report = sweeper.sweep().orElseThrow();
        assertEquals(2, report.getRetried());
        assertEquals(1, report.getFailed());
        verify(vpnServiceContract).provision(3L);
        verify(vpnServiceContract).provision(4L);
    }

    @Test
    void sweep_repairsDriftedUsers() {
        when(subscriptionRepository.findAllUserIdsWithValidSubscription(now)).thenReturn(List.of(1L, 2L, 5L));
        when(vpnServiceContract.findUsersWithActiveConnection()).thenReturn(Set.of(2L, 3L, 4L));
        when(vpnServiceContract.findUsersWithProvisioningFailure()).thenReturn(Set.of(4L, 5L));

        val report = sweeper.sweep().orElseThrow();
        assertEquals(2, report.getRepaired());
        verify(vpnServiceContract).provision(1L);
        verify(vpnServiceContract).provision(3L);
        verify(vpnServiceContract, never()).provision(2L);
        verify(vpnServiceContract, never()).provision(4L);
        verify(vpnServiceContract, never()).provision(5L);
    }

    @Test
    void sweep_afterStop() {
        lenient().when(subscriptionRepository.findAllActiveEndedBefore(eq(now), any()))
            .thenReturn(List.of(buildSubscription(5L, 1L, now.minusSeconds(1))));

        sweeper.stop();
        val report = sweeper.sweep().orElseThrow();
        assertEquals(0, report.getExpired());
        verify(subscriptionRepository, never()).findById(anyLong());
    }

    @NonNull
    private static Subscription buildSubscription(long id, long userId, @NonNull OffsetDateTime endAt) {
        return Subscription.builder()
            .id(id)
            .userId(userId)
            .startAt(endAt.minusDays(30))
            .endAt(endAt)
            .build();
    }
}

package com.vpnbot.api.notification;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.notification.entities.Notification;
import com.vpnbot.api.notification.entities.NotificationRepository;
import com.vpnbot.api.notification.exceptions.NotificationDispatchException;
import com.vpnbot.api.notification.exceptions.NotificationNotFoundException;
import com.vpnbot.api.platform.transaction.UnitOfWork;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    private NotificationService service;

    @BeforeEach
    void setUp() {
        val clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        service = new NotificationService(
            notificationRepository,
            notificationDispatcher,
            new UnitOfWork(mock(PlatformTransactionManager.class)),
            clock);
    }

    @Test
    void notify_onlyOncePerReference() throws NotificationDispatchException {
        val payload = Map.<String, Object>of("days", 7);
        when(notificationRepository.existsByReference(1L, NotificationKind.TRIAL_ACTIVATED, "trial:1"))
            .thenReturn(false)
            .thenReturn(true);

        assertTrue(service.notify(1L, NotificationKind.TRIAL_ACTIVATED, "trial:1", payload));
        assertFalse(service.notify(1L, NotificationKind.TRIAL_ACTIVATED, "trial:1", payload));

        val captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository, times(1)).save(captor.capture());
        assertEquals("trial:1", captor.getValue().getReferenceKey());
        assertEquals("Trial activated", captor.getValue().getTitle());
        assertTrue(captor.getValue().getMessage().startsWith("Your 7-day trial"));
        verify(notificationDispatcher, times(1)).notify(1L, NotificationKind.TRIAL_ACTIVATED, payload);
    }

    @Test
    void notify_withoutReference() throws NotificationDispatchException {
        assertTrue(service.notify(1L, NotificationKind.ACCESS_RESTORED, null, Map.of()));
        assertTrue(service.notify(1L, NotificationKind.ACCESS_RESTORED, null, Map.of()));

        verify(notificationRepository, never()).existsByReference(anyLong(), any(), any());
        verify(notificationDispatcher, times(2)).notify(eq(1L), eq(NotificationKind.ACCESS_RESTORED), any());
    }

    @Test
    void notify_withConcurrentlyRecordedReference() throws NotificationDispatchException {
        when(notificationRepository.existsByReference(1L, NotificationKind.PAYMENT_SUCCEEDED, "payment:p1"))
            .thenReturn(false);
        when(notificationRepository.save(any())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertFalse(service.notify(1L, NotificationKind.PAYMENT_SUCCEEDED, "payment:p1", Map.of()));
        verify(notificationDispatcher, never()).notify(anyLong(), any(), any());
    }

    @Test
    void dispatch_withFailingChannel() throws NotificationDispatchException {
        doThrow(new NotificationDispatchException("blocked", null))
            .when(notificationDispatcher).notify(1L, NotificationKind.REFERRAL_BONUS, Map.of());

        assertDoesNotThrow(() -> service.dispatch(1L, NotificationKind.REFERRAL_BONUS, Map.of()));
    }

    @Test
    void record() throws NotificationDispatchException {
        when(notificationRepository.existsByReference(2L, NotificationKind.REFERRAL_BONUS, "referee:3"))
            .thenReturn(false);

        assertTrue(service.record(2L, NotificationKind.REFERRAL_BONUS, "referee:3", Map.of("days", 7)));
        verify(notificationRepository).save(any());
        verify(notificationDispatcher, never()).notify(anyLong(), any(), any());
    }

    @Test
    void listNotifications() {
        val notification = Notification.builder()
            .id(5L)
            .userId(1L)
            .kind(NotificationKind.SUBSCRIPTION_EXPIRED)
            .title("title")
            .message("message")
            .createdAt(OffsetDateTime.now())
            .build();

        when(notificationRepository.findAllUnreadByUserId(eq(1L), any())).thenReturn(List.of(notification));

        val response = service.listNotifications(1L, true, 0);
        assertEquals(1, response.size());
        assertEquals(5L, response.get(0).getId());
        assertEquals(NotificationKind.Level.INFO, response.get(0).getLevel());
        assertFalse(response.get(0).getIsRead());
    }

    @Test
    void markRead() throws NotificationNotFoundException {
        val notification = Notification.builder()
            .id(5L)
            .userId(1L)
            .kind(NotificationKind.SUBSCRIPTION_EXPIRED)
            .title("title")
            .message("message")
            .build();

        when(notificationRepository.findByIdAndUserId(5L, 1L)).thenReturn(Optional.of(notification));
        when(notificationRepository.findByIdAndUserId(5L, 2L)).thenReturn(Optional.empty());

        service.markRead(1L, 5L);
        assertTrue(notification.isRead());
        verify(notificationRepository).save(notification);
        assertThrows(NotificationNotFoundException.class, () -> service.markRead(2L, 5L));
    }
}

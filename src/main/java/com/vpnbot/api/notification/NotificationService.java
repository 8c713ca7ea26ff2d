package com.vpnbot.api.notification;

import com.vpnbot.api.contracts.NotificationKind;
import com.vpnbot.api.contracts.NotificationServiceContract;
import com.vpnbot.api.notification.entities.Notification;
import com.vpnbot.api.notification.entities.NotificationRepository;
import com.vpnbot.api.notification.exceptions.NotificationDispatchException;
import com.vpnbot.api.notification.exceptions.NotificationNotFoundException;
import com.vpnbot.api.notification.payload.NotificationResponse;
import com.vpnbot.api.platform.transaction.UnitOfWork;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link NotificationService} keeps the users' notification history and delivers notifications
 * through the {@link NotificationDispatcher}.
 */
@Service
@Slf4j
class NotificationService implements NotificationServiceContract {

    static final int PAGE_SIZE = 20;

    private final NotificationRepository notificationRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    @Autowired
    NotificationService(
        @NonNull NotificationRepository notificationRepository,
        @NonNull NotificationDispatcher notificationDispatcher,
        @NonNull UnitOfWork unitOfWork,
        @NonNull Clock clock
    ) {
        this.notificationRepository = notificationRepository;
        this.notificationDispatcher = notificationDispatcher;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean record(long userId, @NonNull NotificationKind kind, String reference, @NonNull Map<String, Object> payload) {
        return insert(userId, kind, reference, payload);
    }

    @Override
    public boolean exists(long userId, @NonNull NotificationKind kind, @NonNull String reference) {
        return notificationRepository.existsByReference(userId, kind, reference);
    }

    @Override
    public void dispatch(long userId, @NonNull NotificationKind kind, @NonNull Map<String, Object> payload) {
        try {
            notificationDispatcher.notify(userId, kind, payload);
        } catch (NotificationDispatchException | RuntimeException e) {
            log.warn("failed to deliver {} notification to user {}", kind, userId, e);
        }
    }

    @Override
    public boolean notify(long userId, @NonNull NotificationKind kind, String reference, @NonNull Map<String, Object> payload) {
        final boolean isRecorded;
        try {
            isRecorded = unitOfWork.execute(() -> insert(userId, kind, reference, payload));
        } catch (DataIntegrityViolationException e) {
            // a concurrent caller recorded the same reference first.
            log.debug("{} notification {} of user {} was recorded concurrently", kind, reference, userId);
            return false;
        }

        if (isRecorded) {
            dispatch(userId, kind, payload);
        }

        return isRecorded;
    }

    /**
     * Lists a {@code page} of the user's notifications, newest first. Each page contains at most
     * {@value PAGE_SIZE} entries.
     */
    @NonNull
    List<NotificationResponse> listNotifications(long userId, boolean onlyUnread, int page) {
        val pageable = PageRequest.of(page, PAGE_SIZE);
        val notifications = onlyUnread
            ? notificationRepository.findAllUnreadByUserId(userId, pageable)
            : notificationRepository.findAllByUserId(userId, pageable);

        return notifications.stream()
            .map(NotificationService::buildNotificationResponse)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @throws NotificationNotFoundException if the notification doesn't exist or belongs to
     *                                       another user.
     */
    @Transactional(rollbackFor = Throwable.class)
    void markRead(long userId, long notificationId) throws NotificationNotFoundException {
        val notification = notificationRepository.findByIdAndUserId(notificationId, userId)
            .orElseThrow(() -> new NotificationNotFoundException("notification doesn't exist"));

        if (!notification.isRead()) {
            notification.setRead(true);
            notificationRepository.save(notification);
        }
    }

    /**
     * @return the number of notifications that were marked as read.
     */
    int markAllRead(long userId) {
        return notificationRepository.markAllReadByUserId(userId);
    }

    private boolean insert(long userId, @NonNull NotificationKind kind, String reference, @NonNull Map<String, Object> payload) {
        if (reference != null && notificationRepository.existsByReference(userId, kind, reference)) {
            return false;
        }

        notificationRepository.save(
            Notification.builder()
                .userId(userId)
                .kind(kind)
                .title(NotificationFormatter.title(kind))
                .message(NotificationFormatter.message(kind, payload))
                .referenceKey(reference)
                .createdAt(OffsetDateTime.now(clock))
                .build());

        return true;
    }

    @NonNull
    private static NotificationResponse buildNotificationResponse(@NonNull Notification notification) {
        return NotificationResponse.builder()
            .id(notification.getId())
            .kind(notification.getKind())
            .level(notification.getKind().getLevel())
            .title(notification.getTitle())
            .message(notification.getMessage())
            .isRead(notification.isRead())
            .createdAt(notification.getCreatedAt())
            .build();
    }
}

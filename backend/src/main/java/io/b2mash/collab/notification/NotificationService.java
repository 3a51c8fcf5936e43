package io.b2mash.collab.notification;

import io.b2mash.collab.exception.ResourceNotFoundException;
import io.b2mash.collab.persistence.PersistenceExecutor;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  private final NotificationRepository notificationRepository;
  private final PersistenceExecutor executor;

  public NotificationService(
      NotificationRepository notificationRepository, PersistenceExecutor executor) {
    this.notificationRepository = notificationRepository;
    this.executor = executor;
  }

  public Page<Notification> listNotifications(Long userId, boolean unreadOnly, Pageable pageable) {
    return executor.executeReadOnly(
        () ->
            unreadOnly
                ? notificationRepository.findUnreadByUserId(userId, pageable)
                : notificationRepository.findByUserId(userId, pageable),
        "listNotifications");
  }

  public long getUnreadCount(Long userId) {
    return executor.executeReadOnly(
        () -> notificationRepository.countUnreadByUserId(userId), "countUnreadNotifications");
  }

  /** Marks the caller's own notification read. Other users' notifications are reported missing. */
  public Notification markRead(Long notificationId, Long userId) {
    return executor.executeTransactionWithRetry(
        () -> {
          var notification =
              notificationRepository
                  .findById(notificationId)
                  .filter(n -> n.getUserId().equals(userId))
                  .orElseThrow(
                      () -> new ResourceNotFoundException("Notification", notificationId));
          if (!notification.isRead()) {
            notification.markRead(Instant.now());
          }
          return notificationRepository.save(notification);
        },
        "markNotificationRead");
  }

  public int markAllRead(Long userId) {
    int updated =
        executor.executeTransactionWithRetry(
            () -> notificationRepository.markAllRead(userId, Instant.now()),
            "markAllNotificationsRead");
    log.info("Marked {} notification(s) read for user {}", updated, userId);
    return updated;
  }

  /** Records an outbound delivery. Notifications already read stay read. */
  public void markSent(Long notificationId) {
    executor.runTransactionWithRetry(
        () ->
            notificationRepository
                .findById(notificationId)
                .filter(n -> n.getStatus() == NotificationStatus.PENDING)
                .ifPresent(
                    n -> {
                      n.markSent(Instant.now());
                      notificationRepository.save(n);
                    }),
        "markNotificationSent");
  }
}

package io.b2mash.collab.notification;

import io.b2mash.collab.security.CurrentUser;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

  private final NotificationService notificationService;

  public NotificationController(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @GetMapping
  public ResponseEntity<Page<NotificationResponse>> listNotifications(
      @RequestParam(defaultValue = "false") boolean unreadOnly,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    var pageable = PageRequest.of(page, Math.min(size, 100));
    var notifications =
        notificationService.listNotifications(CurrentUser.requireUserId(), unreadOnly, pageable);
    return ResponseEntity.ok(notifications.map(NotificationResponse::from));
  }

  @GetMapping("/unread-count")
  public ResponseEntity<UnreadCountResponse> getUnreadCount() {
    return ResponseEntity.ok(
        new UnreadCountResponse(notificationService.getUnreadCount(CurrentUser.requireUserId())));
  }

  @PutMapping("/{id}/read")
  public ResponseEntity<NotificationResponse> markAsRead(@PathVariable Long id) {
    var notification = notificationService.markRead(id, CurrentUser.requireUserId());
    return ResponseEntity.ok(NotificationResponse.from(notification));
  }

  @PutMapping("/read-all")
  public ResponseEntity<Void> markAllAsRead() {
    notificationService.markAllRead(CurrentUser.requireUserId());
    return ResponseEntity.noContent().build();
  }

  public record UnreadCountResponse(long count) {}
}

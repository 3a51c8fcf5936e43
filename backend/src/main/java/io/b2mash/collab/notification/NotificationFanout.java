package io.b2mash.collab.notification;

import io.b2mash.collab.member.User;
import io.b2mash.collab.member.UserService;
import io.b2mash.collab.member.UserSummary;
import io.b2mash.collab.notification.channel.NotificationDispatcher;
import io.b2mash.collab.persistence.PersistenceExecutor;
import io.b2mash.collab.realtime.BroadcastDispatcher;
import io.b2mash.collab.realtime.DeliveryReport;
import io.b2mash.collab.realtime.EventType;
import io.b2mash.collab.realtime.RealtimeEvent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns committed mutations into per-recipient notification records and realtime pushes.
 *
 * <p>Fanout always runs after the triggering mutation has committed and is best-effort relative
 * to it: every per-recipient failure is logged and reported in the returned outcome, and nothing
 * is rethrown to the caller.
 */
@Component
public class NotificationFanout {

  private static final Logger log = LoggerFactory.getLogger(NotificationFanout.class);

  private final NotificationRepository notificationRepository;
  private final UserService userService;
  private final PersistenceExecutor executor;
  private final NotificationDispatcher notificationDispatcher;
  private final BroadcastDispatcher broadcastDispatcher;

  public NotificationFanout(
      NotificationRepository notificationRepository,
      UserService userService,
      PersistenceExecutor executor,
      NotificationDispatcher notificationDispatcher,
      BroadcastDispatcher broadcastDispatcher) {
    this.notificationRepository = notificationRepository;
    this.userService = userService;
    this.executor = executor;
    this.notificationDispatcher = notificationDispatcher;
    this.broadcastDispatcher = broadcastDispatcher;
  }

  /**
   * Persists a pending notification for each recipient that has a contact address, each in its
   * own transaction, then hands it to the delivery channels.
   */
  public FanoutOutcome notify(NotificationRequest request, Collection<Long> recipientIds) {
    if (recipientIds.isEmpty()) {
      return FanoutOutcome.NONE;
    }

    Map<Long, User> recipients;
    try {
      recipients = userService.findAllById(recipientIds);
    } catch (RuntimeException e) {
      log.warn(
          "Fanout of {} aborted: recipient lookup failed: {}",
          request.type().value(),
          e.getMessage());
      return new FanoutOutcome(
          recipientIds.size(), 0, 0, List.copyOf(recipientIds), DeliveryReport.EMPTY);
    }

    int persisted = 0;
    int skipped = 0;
    var failed = new ArrayList<Long>();
    var delivery = DeliveryReport.EMPTY;

    for (Long recipientId : recipientIds) {
      var user = recipients.get(recipientId);
      if (user == null || !user.hasContactAddress()) {
        log.debug(
            "Skipping {} for user {}: no contact address", request.type().value(), recipientId);
        skipped++;
        continue;
      }
      Notification notification;
      try {
        notification =
            executor.executeTransactionWithRetry(
                () ->
                    notificationRepository.save(
                        new Notification(
                            recipientId,
                            request.type(),
                            request.subject(),
                            request.content(),
                            user.getEmail(),
                            request.relatedEntityType(),
                            request.relatedEntityId())),
                "persistNotification");
        persisted++;
      } catch (RuntimeException e) {
        log.warn(
            "Failed to record {} notification for user {}: {}",
            request.type().value(),
            recipientId,
            e.getMessage());
        failed.add(recipientId);
        continue;
      }
      delivery = delivery.plus(notificationDispatcher.dispatch(notification, user.getEmail()));
    }

    log.info(
        "Fanout {} for {} {}: audience={}, persisted={}, skipped={}, failed={}",
        request.type().value(),
        request.relatedEntityType(),
        request.relatedEntityId(),
        recipientIds.size(),
        persisted,
        skipped,
        failed.size());
    return new FanoutOutcome(
        recipientIds.size(), persisted, skipped, List.copyOf(failed), delivery);
  }

  /**
   * Pushes a chat event to the recipients' open connections, with the sender's public identity
   * added under {@code sender}.
   */
  public DeliveryReport deliverChat(
      EventType type, Map<String, Object> payload, Long senderId, Collection<Long> recipientIds) {
    try {
      UserSummary sender = userService.summarize(senderId);
      var enriched = new LinkedHashMap<String, Object>(payload);
      enriched.put("sender", sender);
      return broadcastDispatcher.sendToUsers(RealtimeEvent.of(type, enriched), recipientIds);
    } catch (RuntimeException e) {
      log.warn("Chat delivery of {} failed: {}", type.wireName(), e.getMessage());
      return new DeliveryReport(recipientIds.size(), 0, recipientIds.size());
    }
  }
}

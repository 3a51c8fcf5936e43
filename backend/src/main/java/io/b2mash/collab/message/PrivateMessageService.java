package io.b2mash.collab.message;

import io.b2mash.collab.exception.DatabaseException;
import io.b2mash.collab.exception.ResourceNotFoundException;
import io.b2mash.collab.exception.ValidationException;
import io.b2mash.collab.member.User;
import io.b2mash.collab.member.UserService;
import io.b2mash.collab.member.UserSummary;
import io.b2mash.collab.notification.MutationOutcome;
import io.b2mash.collab.notification.NotificationFanout;
import io.b2mash.collab.notification.NotificationRequest;
import io.b2mash.collab.notification.NotificationType;
import io.b2mash.collab.persistence.PersistenceExecutor;
import io.b2mash.collab.realtime.EventType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

@Service
public class PrivateMessageService {

  private static final Logger log = LoggerFactory.getLogger(PrivateMessageService.class);
  static final String ENTITY_TYPE = "private_message";

  private final PrivateMessageRepository messageRepository;
  private final UserService userService;
  private final PersistenceExecutor executor;
  private final NotificationFanout notificationFanout;

  public PrivateMessageService(
      PrivateMessageRepository messageRepository,
      UserService userService,
      PersistenceExecutor executor,
      NotificationFanout notificationFanout) {
    this.messageRepository = messageRepository;
    this.userService = userService;
    this.executor = executor;
    this.notificationFanout = notificationFanout;
  }

  /**
   * Stores the message, pushes it to both parties' open connections and records a pending
   * notification for the recipient.
   */
  public MutationOutcome<PrivateMessageResponse> send(
      Long recipientId, String content, Long senderId) {
    if (content == null || content.isBlank()) {
      throw new ValidationException("Message content is required");
    }
    if (recipientId.equals(senderId)) {
      throw new ValidationException("Cannot send a message to yourself");
    }
    var sent =
        persist(
            () -> {
              if (!userService.exists(recipientId)) {
                throw new ResourceNotFoundException("User", recipientId);
              }
              var saved =
                  messageRepository.save(
                      new PrivateMessage(senderId, recipientId, content.strip()));
              return new Sent(saved, userService.summarize(senderId));
            },
            "sendPrivateMessage");
    var message = sent.message();
    var sender = sent.sender();
    log.info(
        "Private message {} sent from user {} to user {}", message.getId(), senderId, recipientId);

    var payload = new LinkedHashMap<String, Object>();
    payload.put("id", message.getId());
    payload.put("senderId", senderId);
    payload.put("recipientId", recipientId);
    payload.put("content", message.getContent());
    payload.put("createdAt", message.getCreatedAt());

    var failures = new ArrayList<String>();
    var delivery =
        notificationFanout.deliverChat(
            EventType.PRIVATE_MESSAGE, payload, senderId, List.of(recipientId, senderId));
    if (delivery.failed() > 0) {
      failures.add("broadcast:" + EventType.PRIVATE_MESSAGE.wireName());
    }

    var request =
        new NotificationRequest(
            NotificationType.PRIVATE_MESSAGE,
            "New message from " + displayName(sender),
            message.getContent(),
            ENTITY_TYPE,
            message.getId());
    if (notificationFanout.notify(request, List.of(recipientId)).hasFailures()) {
      failures.add("fanout:" + NotificationType.PRIVATE_MESSAGE.value());
    }
    return new MutationOutcome<>(PrivateMessageResponse.from(message, sender), failures);
  }

  /** Messages between the two users, oldest first. */
  public List<PrivateMessageResponse> conversation(Long userId, Long otherUserId) {
    return read(
        () -> {
          var messages = messageRepository.findConversation(userId, otherUserId);
          var users = userService.findAllById(List.of(userId, otherUserId));
          return messages.stream()
              .map(m -> PrivateMessageResponse.from(m, summary(users, m.getSenderId())))
              .toList();
        },
        "getConversation");
  }

  /** One entry per conversation partner, most recently active first. */
  public List<ConversationSummary> conversations(Long userId) {
    return read(
        () -> {
          var latest = new LinkedHashMap<Long, PrivateMessage>();
          var unread = new LinkedHashMap<Long, Long>();
          for (var message : messageRepository.findAllInvolving(userId)) {
            var partner = message.partnerOf(userId);
            latest.putIfAbsent(partner, message);
            if (message.isUnreadFor(userId)) {
              unread.merge(partner, 1L, Long::sum);
            }
          }
          var ids = new ArrayList<Long>(latest.keySet());
          ids.add(userId);
          var users = userService.findAllById(ids);
          return latest.entrySet().stream()
              .map(
                  e ->
                      new ConversationSummary(
                          summary(users, e.getKey()),
                          PrivateMessageResponse.from(
                              e.getValue(), summary(users, e.getValue().getSenderId())),
                          unread.getOrDefault(e.getKey(), 0L)))
              .toList();
        },
        "getConversations");
  }

  public long unreadCount(Long userId) {
    return read(() -> messageRepository.countByRecipientIdAndReadAtIsNull(userId), "unreadCount");
  }

  /** Marks everything {@code otherUserId} sent to {@code userId} as read. */
  public int markRead(Long userId, Long otherUserId) {
    int updated =
        persist(
            () -> messageRepository.markConversationRead(userId, otherUserId, Instant.now()),
            "markMessagesRead");
    log.debug("Marked {} message(s) from user {} read for user {}", updated, otherUserId, userId);
    return updated;
  }

  private record Sent(PrivateMessage message, UserSummary sender) {}

  private static UserSummary summary(Map<Long, User> users, Long userId) {
    var user = users.get(userId);
    return user != null ? UserSummary.from(user) : UserSummary.unknown(userId);
  }

  private static String displayName(UserSummary user) {
    if (user.fullName() != null && !user.fullName().isBlank()) {
      return user.fullName();
    }
    return user.username() != null ? user.username() : "user " + user.id();
  }

  private <T> T persist(Supplier<T> unit, String operationName) {
    try {
      return executor.executeTransactionWithRetry(unit, operationName);
    } catch (DataAccessException | TransactionException e) {
      throw new DatabaseException(operationName, e);
    }
  }

  private <T> T read(Supplier<T> query, String operationName) {
    try {
      return executor.executeReadOnly(query, operationName);
    } catch (DataAccessException | TransactionException e) {
      throw new DatabaseException(operationName, e);
    }
  }
}

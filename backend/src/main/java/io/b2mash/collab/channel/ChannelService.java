package io.b2mash.collab.channel;

import io.b2mash.collab.channel.ChannelResponses.ChannelResponse;
import io.b2mash.collab.channel.ChannelResponses.GroupMessageResponse;
import io.b2mash.collab.channel.ChannelResponses.MemberResponse;
import io.b2mash.collab.exception.DatabaseException;
import io.b2mash.collab.exception.InvalidStateException;
import io.b2mash.collab.exception.ResourceNotFoundException;
import io.b2mash.collab.exception.ValidationException;
import io.b2mash.collab.member.User;
import io.b2mash.collab.member.UserService;
import io.b2mash.collab.member.UserSummary;
import io.b2mash.collab.notification.Audience;
import io.b2mash.collab.notification.MutationOutcome;
import io.b2mash.collab.notification.NotificationFanout;
import io.b2mash.collab.notification.NotificationRequest;
import io.b2mash.collab.notification.NotificationType;
import io.b2mash.collab.persistence.PersistenceExecutor;
import io.b2mash.collab.realtime.BroadcastDispatcher;
import io.b2mash.collab.realtime.EventType;
import io.b2mash.collab.realtime.RealtimeEvent;
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
public class ChannelService {

  private static final Logger log = LoggerFactory.getLogger(ChannelService.class);
  static final String ENTITY_TYPE = "group_channel";

  private final GroupChannelRepository channelRepository;
  private final ChannelMemberRepository memberRepository;
  private final GroupMessageRepository messageRepository;
  private final ChannelMembershipResolver membership;
  private final UserService userService;
  private final PersistenceExecutor executor;
  private final BroadcastDispatcher broadcastDispatcher;
  private final NotificationFanout notificationFanout;

  public ChannelService(
      GroupChannelRepository channelRepository,
      ChannelMemberRepository memberRepository,
      GroupMessageRepository messageRepository,
      ChannelMembershipResolver membership,
      UserService userService,
      PersistenceExecutor executor,
      BroadcastDispatcher broadcastDispatcher,
      NotificationFanout notificationFanout) {
    this.channelRepository = channelRepository;
    this.memberRepository = memberRepository;
    this.messageRepository = messageRepository;
    this.membership = membership;
    this.userService = userService;
    this.executor = executor;
    this.broadcastDispatcher = broadcastDispatcher;
    this.notificationFanout = notificationFanout;
  }

  // --- Channels ---

  /** Creates the channel and makes the creator its first admin, in one transaction. */
  public ChannelResponse createChannel(
      String name, String description, boolean isPrivate, Long creatorId) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Channel name is required");
    }
    var channel =
        persist(
            () -> {
              var saved =
                  channelRepository.save(
                      new GroupChannel(name.strip(), description, isPrivate, creatorId));
              memberRepository.save(new ChannelMember(saved.getId(), creatorId, true));
              return saved;
            },
            "createChannel");
    log.info(
        "Channel {} created by user {} (private={})", channel.getId(), creatorId, isPrivate);
    return ChannelResponse.from(channel);
  }

  public List<ChannelResponse> listChannels(Long userId) {
    return read(
        () -> membership.visibleChannels(userId).stream().map(ChannelResponse::from).toList(),
        "listChannels");
  }

  public ChannelResponse getChannel(Long channelId, Long userId) {
    return read(
        () -> ChannelResponse.from(membership.requireMember(channelId, userId)), "getChannel");
  }

  // --- Members ---

  public List<MemberResponse> listMembers(Long channelId, Long userId) {
    return read(
        () -> {
          membership.requireMember(channelId, userId);
          var members = memberRepository.findByChannelIdOrderByJoinedAtAsc(channelId);
          var users =
              userService.findAllById(members.stream().map(ChannelMember::getUserId).toList());
          return members.stream()
              .map(m -> MemberResponse.from(m, summary(users, m.getUserId())))
              .toList();
        },
        "listChannelMembers");
  }

  /** Admin-only. The added user is told over their open connections. */
  public MutationOutcome<MemberResponse> addMember(
      Long channelId, Long userId, boolean isAdmin, Long actorId) {
    var added =
        persist(
            () -> {
              membership.requireAdmin(channelId, actorId);
              if (!userService.exists(userId)) {
                throw new ResourceNotFoundException("User", userId);
              }
              if (memberRepository.existsByChannelIdAndUserId(channelId, userId)) {
                throw new InvalidStateException(
                    "Already a member",
                    "User " + userId + " is already a member of channel " + channelId);
              }
              var member = memberRepository.save(new ChannelMember(channelId, userId, isAdmin));
              return MemberResponse.from(member, userService.summarize(userId));
            },
            "addChannelMember");
    log.info("User {} added to channel {} by user {}", userId, channelId, actorId);

    var failures = new ArrayList<String>();
    notifyMember(
        failures,
        EventType.CHANNEL_MEMBER_ADDED,
        Map.of("channelId", channelId, "addedBy", actorId),
        userId);
    return new MutationOutcome<>(added, failures);
  }

  /**
   * Removes a membership row. Members may remove themselves; anyone else needs admin rights.
   * Only a user removed by someone else is told about it.
   */
  public MutationOutcome<Void> removeMember(Long channelId, Long userId, Long actorId) {
    persist(
        () -> {
          membership.checkRemoval(channelId, userId, actorId);
          return memberRepository.deleteMembership(channelId, userId);
        },
        "removeChannelMember");
    log.info("User {} removed from channel {} by user {}", userId, channelId, actorId);

    var failures = new ArrayList<String>();
    if (!userId.equals(actorId)) {
      notifyMember(
          failures,
          EventType.CHANNEL_MEMBER_REMOVED,
          Map.of("channelId", channelId, "removedBy", actorId),
          userId);
    }
    return new MutationOutcome<>(null, failures);
  }

  // --- Messages ---

  public List<GroupMessageResponse> listMessages(Long channelId, Long userId) {
    return read(
        () -> {
          membership.requireMember(channelId, userId);
          var messages = messageRepository.findByChannelIdOrderByCreatedAtAscIdAsc(channelId);
          var senders =
              userService.findAllById(messages.stream().map(GroupMessage::getSenderId).toList());
          return messages.stream()
              .map(m -> GroupMessageResponse.from(m, summary(senders, m.getSenderId())))
              .toList();
        },
        "listGroupMessages");
  }

  /**
   * Posts a message. Posting to a public channel joins the poster first; the message then goes
   * to every explicit member, the poster included.
   */
  public MutationOutcome<GroupMessageResponse> postMessage(
      Long channelId, String content, Long senderId) {
    if (content == null || content.isBlank()) {
      throw new ValidationException("Message content is required");
    }
    var posted =
        persist(
            () -> {
              var channel = membership.requireChannel(channelId);
              membership.ensureMembershipForPost(channel, senderId);
              var message =
                  messageRepository.save(new GroupMessage(channelId, senderId, content.strip()));
              var memberIds = memberRepository.findUserIdsByChannelId(channelId);
              return new Posted(channel, message, memberIds, userService.summarize(senderId));
            },
            "postGroupMessage");

    var message = posted.message();
    var response = GroupMessageResponse.from(message, posted.sender());

    var payload = new LinkedHashMap<String, Object>();
    payload.put("id", message.getId());
    payload.put("channelId", channelId);
    payload.put("senderId", senderId);
    payload.put("content", message.getContent());
    payload.put("createdAt", message.getCreatedAt());

    var failures = new ArrayList<String>();
    var delivery =
        notificationFanout.deliverChat(
            EventType.NEW_GROUP_MESSAGE, payload, senderId, posted.memberIds());
    if (delivery.failed() > 0) {
      failures.add("broadcast:" + EventType.NEW_GROUP_MESSAGE.wireName());
    }

    var request =
        new NotificationRequest(
            NotificationType.GROUP_MESSAGE,
            "New message in " + posted.channel().getName(),
            message.getContent(),
            ENTITY_TYPE,
            channelId);
    var outcome =
        notificationFanout.notify(request, Audience.excluding(posted.memberIds(), senderId));
    if (outcome.hasFailures()) {
      failures.add("fanout:" + NotificationType.GROUP_MESSAGE.value());
    }
    return new MutationOutcome<>(response, failures);
  }

  // --- Helpers ---

  private record Posted(
      GroupChannel channel, GroupMessage message, List<Long> memberIds, UserSummary sender) {}

  private void notifyMember(
      List<String> failures, EventType type, Map<String, Object> data, Long userId) {
    try {
      var report = broadcastDispatcher.sendToUsers(RealtimeEvent.of(type, data), List.of(userId));
      if (report.failed() > 0) {
        failures.add("broadcast:" + type.wireName());
      }
    } catch (RuntimeException e) {
      log.warn("Send of {} to user {} failed: {}", type.wireName(), userId, e.getMessage());
      failures.add("broadcast:" + type.wireName());
    }
  }

  private static UserSummary summary(Map<Long, User> users, Long userId) {
    var user = users.get(userId);
    return user != null ? UserSummary.from(user) : UserSummary.unknown(userId);
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

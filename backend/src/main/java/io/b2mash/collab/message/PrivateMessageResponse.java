package io.b2mash.collab.message;

import io.b2mash.collab.member.UserSummary;
import java.time.Instant;

public record PrivateMessageResponse(
    Long id,
    Long senderId,
    Long recipientId,
    String content,
    Instant createdAt,
    Instant readAt,
    UserSummary sender) {

  public static PrivateMessageResponse from(PrivateMessage message, UserSummary sender) {
    return new PrivateMessageResponse(
        message.getId(),
        message.getSenderId(),
        message.getRecipientId(),
        message.getContent(),
        message.getCreatedAt(),
        message.getReadAt(),
        sender);
  }
}

package io.b2mash.collab.channel;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.collab.member.UserSummary;
import java.time.Instant;

/** Response shapes of the channel API. */
public final class ChannelResponses {

  private ChannelResponses() {}

  public record ChannelResponse(
      Long id,
      String name,
      String description,
      @JsonProperty("isPrivate") boolean isPrivate,
      Long creatorId,
      Instant createdAt) {

    public static ChannelResponse from(GroupChannel channel) {
      return new ChannelResponse(
          channel.getId(),
          channel.getName(),
          channel.getDescription(),
          channel.isPrivate(),
          channel.getCreatorId(),
          channel.getCreatedAt());
    }
  }

  public record MemberResponse(
      Long channelId,
      UserSummary user,
      @JsonProperty("isAdmin") boolean isAdmin,
      Instant joinedAt) {

    public static MemberResponse from(ChannelMember member, UserSummary user) {
      return new MemberResponse(
          member.getChannelId(), user, member.isAdmin(), member.getJoinedAt());
    }
  }

  public record GroupMessageResponse(
      Long id, Long channelId, String content, Instant createdAt, UserSummary sender) {

    public static GroupMessageResponse from(GroupMessage message, UserSummary sender) {
      return new GroupMessageResponse(
          message.getId(),
          message.getChannelId(),
          message.getContent(),
          message.getCreatedAt(),
          sender);
    }
  }
}

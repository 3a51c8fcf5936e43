package io.b2mash.collab.channel;

import java.io.Serializable;
import java.util.Objects;

public class ChannelMemberId implements Serializable {

  private Long channelId;
  private Long userId;

  protected ChannelMemberId() {}

  public ChannelMemberId(Long channelId, Long userId) {
    this.channelId = channelId;
    this.userId = userId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChannelMemberId other)) {
      return false;
    }
    return Objects.equals(channelId, other.channelId) && Objects.equals(userId, other.userId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(channelId, userId);
  }
}

package io.b2mash.collab.channel;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.time.Instant;

/** Explicit membership row. Admins may add and remove other members. */
@Entity
@Table(name = "channel_members")
@IdClass(ChannelMemberId.class)
public class ChannelMember {

  @Id
  @Column(name = "channel_id", nullable = false)
  private Long channelId;

  @Id
  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "is_admin", nullable = false)
  private boolean isAdmin;

  @Column(name = "joined_at", nullable = false, updatable = false)
  private Instant joinedAt;

  protected ChannelMember() {}

  public ChannelMember(Long channelId, Long userId, boolean isAdmin) {
    this.channelId = channelId;
    this.userId = userId;
    this.isAdmin = isAdmin;
    this.joinedAt = Instant.now();
  }

  public Long getChannelId() {
    return channelId;
  }

  public Long getUserId() {
    return userId;
  }

  public boolean isAdmin() {
    return isAdmin;
  }

  public Instant getJoinedAt() {
    return joinedAt;
  }
}

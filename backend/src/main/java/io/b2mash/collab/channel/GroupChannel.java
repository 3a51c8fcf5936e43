package io.b2mash.collab.channel;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** A group chat channel. Public channels are open to every authenticated user. */
@Entity
@Table(name = "group_channels")
public class GroupChannel {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", length = 2000)
  private String description;

  @Column(name = "is_private", nullable = false)
  private boolean isPrivate;

  @Column(name = "creator_id", nullable = false)
  private Long creatorId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected GroupChannel() {}

  public GroupChannel(String name, String description, boolean isPrivate, Long creatorId) {
    this.name = name;
    this.description = description;
    this.isPrivate = isPrivate;
    this.creatorId = creatorId;
    this.createdAt = Instant.now();
  }

  public void update(String name, String description, boolean isPrivate) {
    this.name = name;
    this.description = description;
    this.isPrivate = isPrivate;
  }

  public boolean isPublic() {
    return !isPrivate;
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isPrivate() {
    return isPrivate;
  }

  public Long getCreatorId() {
    return creatorId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

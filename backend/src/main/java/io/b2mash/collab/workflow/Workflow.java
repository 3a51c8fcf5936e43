package io.b2mash.collab.workflow;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "workflows")
public class Workflow {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", length = 2000)
  private String description;

  @Column(name = "creator_id", nullable = false)
  private Long creatorId;

  @Column(name = "is_default", nullable = false)
  private boolean isDefault;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Workflow() {}

  public Workflow(String name, String description, Long creatorId, boolean isDefault) {
    this.name = name;
    this.description = description;
    this.creatorId = creatorId;
    this.isDefault = isDefault;
    this.createdAt = Instant.now();
  }

  public void update(String name, String description) {
    this.name = name;
    this.description = description;
  }

  public void setDefault(boolean isDefault) {
    this.isDefault = isDefault;
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

  public Long getCreatorId() {
    return creatorId;
  }

  public boolean isDefault() {
    return isDefault;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

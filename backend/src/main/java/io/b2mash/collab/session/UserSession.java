package io.b2mash.collab.session;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "user_sessions")
public class UserSession {

  @Id
  @Column(name = "sid", nullable = false, length = 64)
  private String sid;

  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "username", nullable = false, length = 100)
  private String username;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  protected UserSession() {}

  public UserSession(String sid, SessionPrincipal principal, Instant createdAt, Instant expiresAt) {
    this.sid = sid;
    this.userId = principal.userId();
    this.username = principal.username();
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
  }

  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public SessionPrincipal toPrincipal() {
    return new SessionPrincipal(userId, username);
  }

  public String getSid() {
    return sid;
  }

  public Long getUserId() {
    return userId;
  }

  public String getUsername() {
    return username;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }
}

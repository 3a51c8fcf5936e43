package io.b2mash.collab.member;

/** Public identity of a user, safe to embed in API responses and realtime payloads. */
public record UserSummary(Long id, String username, String fullName) {

  public static UserSummary from(User user) {
    return new UserSummary(user.getId(), user.getUsername(), user.getFullName());
  }

  public static UserSummary unknown(Long id) {
    return new UserSummary(id, null, null);
  }
}

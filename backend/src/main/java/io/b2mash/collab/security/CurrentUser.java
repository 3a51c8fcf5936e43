package io.b2mash.collab.security;

import io.b2mash.collab.exception.UnauthorizedException;
import io.b2mash.collab.session.SessionPrincipal;
import org.springframework.security.core.context.SecurityContextHolder;

/** Access to the session principal of the current request. */
public final class CurrentUser {

  private CurrentUser() {}

  public static SessionPrincipal requirePrincipal() {
    var auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth != null && auth.getPrincipal() instanceof SessionPrincipal principal) {
      return principal;
    }
    throw new UnauthorizedException("Authentication required");
  }

  public static Long requireUserId() {
    return requirePrincipal().userId();
  }
}

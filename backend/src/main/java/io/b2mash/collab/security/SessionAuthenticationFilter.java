package io.b2mash.collab.security;

import io.b2mash.collab.exception.ErrorType;
import io.b2mash.collab.session.SessionPrincipal;
import io.b2mash.collab.session.SessionStore;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.WebUtils;

/**
 * Authenticates requests carrying a session cookie. Requests without a valid session continue
 * unauthenticated and are rejected by the entry point where the route requires it.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(SessionAuthenticationFilter.class);

  static final String ROLE_USER = "ROLE_USER";

  private final SessionStore sessionStore;
  private final ErrorResponseWriter errorWriter;

  public SessionAuthenticationFilter(SessionStore sessionStore, ErrorResponseWriter errorWriter) {
    this.sessionStore = sessionStore;
    this.errorWriter = errorWriter;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    var cookie = WebUtils.getCookie(request, sessionStore.cookieName());
    if (cookie != null) {
      SessionPrincipal principal;
      try {
        principal = sessionStore.resolve(cookie.getValue()).orElse(null);
      } catch (DataAccessException | TransactionException e) {
        log.error("Session lookup failed for path={}", request.getRequestURI(), e);
        errorWriter.write(response, ErrorType.DATABASE_ERROR, "Session lookup failed");
        return;
      }
      if (principal != null) {
        var authentication =
            new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority(ROLE_USER)));
        SecurityContextHolder.getContext().setAuthentication(authentication);
      }
    }
    filterChain.doFilter(request, response);
  }
}

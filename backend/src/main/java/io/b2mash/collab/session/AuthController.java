package io.b2mash.collab.session;

import io.b2mash.collab.exception.UnauthorizedException;
import io.b2mash.collab.member.UserService;
import io.b2mash.collab.member.UserSummary;
import io.b2mash.collab.security.CurrentUser;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Duration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.WebUtils;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

  private final UserService userService;
  private final SessionStore sessionStore;
  private final SessionProperties sessionProperties;

  public AuthController(
      UserService userService, SessionStore sessionStore, SessionProperties sessionProperties) {
    this.userService = userService;
    this.sessionStore = sessionStore;
    this.sessionProperties = sessionProperties;
  }

  @PostMapping("/register")
  public ResponseEntity<UserSummary> register(@Valid @RequestBody RegisterRequest request) {
    var user =
        userService.register(
            request.username(), request.password(), request.fullName(), request.email());
    return ResponseEntity.created(URI.create("/api/users/" + user.getId()))
        .body(UserSummary.from(user));
  }

  @PostMapping("/login")
  public ResponseEntity<UserSummary> login(@Valid @RequestBody LoginRequest request) {
    var user = userService.authenticate(request.username(), request.password());
    if (user == null) {
      throw new UnauthorizedException("Invalid username or password");
    }
    var sid = sessionStore.create(user);
    return ResponseEntity.ok()
        .header(HttpHeaders.SET_COOKIE, sessionCookie(sid, sessionProperties.ttl()).toString())
        .body(UserSummary.from(user));
  }

  /** Ends the session. Realtime connections opened with it stay open until they close. */
  @PostMapping("/logout")
  public ResponseEntity<Void> logout(HttpServletRequest request) {
    var cookie = WebUtils.getCookie(request, sessionProperties.cookieName());
    if (cookie != null) {
      sessionStore.invalidate(cookie.getValue());
    }
    return ResponseEntity.noContent()
        .header(HttpHeaders.SET_COOKIE, sessionCookie("", Duration.ZERO).toString())
        .build();
  }

  @GetMapping("/me")
  public ResponseEntity<UserSummary> me() {
    return ResponseEntity.ok(UserSummary.from(userService.getUser(CurrentUser.requireUserId())));
  }

  private ResponseCookie sessionCookie(String value, Duration maxAge) {
    return ResponseCookie.from(sessionProperties.cookieName(), value)
        .httpOnly(true)
        .secure(sessionProperties.secureCookie())
        .sameSite("Lax")
        .path("/")
        .maxAge(maxAge)
        .build();
  }

  public record RegisterRequest(
      @NotBlank(message = "username is required")
          @Size(max = 100, message = "username must be at most 100 characters")
          String username,
      @NotBlank(message = "password is required")
          @Size(min = 6, max = 200, message = "password must be 6 to 200 characters")
          String password,
      @Size(max = 200, message = "fullName must be at most 200 characters") String fullName,
      @Email(message = "email must be a valid address") String email) {}

  public record LoginRequest(
      @NotBlank(message = "username is required") String username,
      @NotBlank(message = "password is required") String password) {}
}

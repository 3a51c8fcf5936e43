package io.b2mash.collab.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import jakarta.servlet.http.Cookie;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthControllerIntegrationTest {

  private static final String COOKIE = "collab.sid";

  @Autowired private MockMvc mockMvc;

  // --- Register / login ---

  @Test
  void registerThenLoginIssuesSessionCookie() throws Exception {
    var username = "dana-" + UUID.randomUUID();
    register(username)
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.username").value(username))
        .andExpect(jsonPath("$.passwordHash").doesNotExist());

    var sid = login(username);

    assertThat(SessionTokens.isWellFormed(sid)).isTrue();
    mockMvc
        .perform(get("/api/auth/me").cookie(new Cookie(COOKIE, sid)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.username").value(username));
  }

  @Test
  void duplicateUsernameIsConflict() throws Exception {
    var username = "erin-" + UUID.randomUUID();
    register(username).andExpect(status().isCreated());

    register(username)
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error.type").value("CONFLICT"));
  }

  @Test
  void shortPasswordIsValidationError() throws Exception {
    mockMvc
        .perform(
            post("/api/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\": \"frank\", \"password\": \"123\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error.type").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.error.details.password").exists());
  }

  @Test
  void wrongPasswordIsUnauthorized() throws Exception {
    var username = "gail-" + UUID.randomUUID();
    register(username).andExpect(status().isCreated());

    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(credentials(username, "not-the-password")))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error.type").value("UNAUTHORIZED"));
  }

  // --- Session enforcement ---

  @Test
  void apiRequiresSession() throws Exception {
    mockMvc
        .perform(get("/api/tasks"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error.type").value("UNAUTHORIZED"));
  }

  @Test
  void unknownSessionIsUnauthorized() throws Exception {
    mockMvc
        .perform(get("/api/tasks").cookie(new Cookie(COOKIE, SessionTokens.generate())))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void logoutEndsSession() throws Exception {
    var username = "hank-" + UUID.randomUUID();
    register(username).andExpect(status().isCreated());
    var sid = login(username);

    mockMvc
        .perform(post("/api/auth/logout").cookie(new Cookie(COOKIE, sid)))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/auth/me").cookie(new Cookie(COOKIE, sid)))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void unknownTaskIsNotFound() throws Exception {
    var username = "ivy-" + UUID.randomUUID();
    register(username).andExpect(status().isCreated());
    var sid = login(username);

    mockMvc
        .perform(get("/api/tasks/999999").cookie(new Cookie(COOKIE, sid)))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error.type").value("NOT_FOUND"));
  }

  private ResultActions register(String username) throws Exception {
    return mockMvc.perform(
        post("/api/auth/register")
            .contentType(MediaType.APPLICATION_JSON)
            .content(credentials(username, "s3cret-pass")));
  }

  private String login(String username) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/auth/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(credentials(username, "s3cret-pass")))
            .andExpect(status().isOk())
            .andReturn();
    var header = result.getResponse().getHeader(HttpHeaders.SET_COOKIE);
    assertThat(header).startsWith(COOKIE + "=");
    return header.substring(COOKIE.length() + 1, header.indexOf(';'));
  }

  private static String credentials(String username, String password) {
    return "{\"username\": \"%s\", \"password\": \"%s\"}".formatted(username, password);
  }
}

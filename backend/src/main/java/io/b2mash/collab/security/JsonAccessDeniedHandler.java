package io.b2mash.collab.security;

import io.b2mash.collab.exception.ErrorType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

@Component
public class JsonAccessDeniedHandler implements AccessDeniedHandler {

  private static final Logger log = LoggerFactory.getLogger(JsonAccessDeniedHandler.class);

  private final ErrorResponseWriter writer;

  public JsonAccessDeniedHandler(ErrorResponseWriter writer) {
    this.writer = writer;
  }

  @Override
  public void handle(
      HttpServletRequest request,
      HttpServletResponse response,
      AccessDeniedException accessDeniedException)
      throws IOException {
    log.warn(
        "security.access_denied: path={}, method={}",
        request.getRequestURI(),
        request.getMethod());
    writer.write(
        response, ErrorType.AUTHORIZATION_ERROR, "Insufficient permissions for this operation");
  }
}

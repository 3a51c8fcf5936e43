package io.b2mash.collab.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.collab.exception.ApiErrorResponse;
import io.b2mash.collab.exception.ErrorType;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/** Writes {@link ApiErrorResponse} bodies from filters, outside the MVC exception handling. */
@Component
public class ErrorResponseWriter {

  private final ObjectMapper objectMapper;

  public ErrorResponseWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public void write(HttpServletResponse response, ErrorType type, String message)
      throws IOException {
    response.setStatus(type.status().value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(response.getOutputStream(), ApiErrorResponse.of(type, message));
  }
}

package io.b2mash.collab.exception;

import org.springframework.http.HttpStatus;

/** Wire-level error categories rendered in {@code {"error": {"type": ...}}} bodies. */
public enum ErrorType {
  VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
  UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
  AUTHORIZATION_ERROR(HttpStatus.FORBIDDEN),
  NOT_FOUND(HttpStatus.NOT_FOUND),
  CONFLICT(HttpStatus.CONFLICT),
  DATABASE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
  INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

  private final HttpStatus status;

  ErrorType(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}

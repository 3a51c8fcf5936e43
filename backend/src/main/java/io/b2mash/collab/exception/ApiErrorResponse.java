package io.b2mash.collab.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Error body shape shared by the REST layer and the security entry points. */
public record ApiErrorResponse(Body error) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Body(String type, String message, Object details) {}

  public static ApiErrorResponse of(ErrorType type, String message) {
    return new ApiErrorResponse(new Body(type.name(), message, null));
  }

  public static ApiErrorResponse of(ErrorType type, String message, Object details) {
    return new ApiErrorResponse(new Body(type.name(), message, details));
  }
}

package io.b2mash.collab.exception;

public class ValidationException extends ApiException {

  public ValidationException(String detail) {
    super(ErrorType.VALIDATION_ERROR, "Validation failed", detail, null);
  }

  public ValidationException(String detail, Object details) {
    super(ErrorType.VALIDATION_ERROR, "Validation failed", detail, details);
  }
}

package io.b2mash.collab.exception;

/**
 * A persistence failure that survived the retry budget. The original driver/Spring exception is
 * kept as the cause; clients only see a generic message.
 */
public class DatabaseException extends ApiException {

  public DatabaseException(String operation, Throwable cause) {
    super(
        ErrorType.DATABASE_ERROR,
        "Database error",
        "Database operation failed: " + operation,
        null,
        cause);
  }
}

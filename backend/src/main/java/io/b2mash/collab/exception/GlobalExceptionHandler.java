package io.b2mash.collab.exception;

import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@ControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ApiException.class)
  public ResponseEntity<ApiErrorResponse> handleApiException(
      ApiException ex, HttpServletRequest request) {
    var type = ex.getErrorType();
    if (type.status().is5xxServerError()) {
      log.error(
          "Request failed: path={}, method={}, type={}",
          request.getRequestURI(),
          request.getMethod(),
          type,
          ex);
    } else {
      log.warn(
          "Request rejected: path={}, method={}, type={}, reason={}",
          request.getRequestURI(),
          request.getMethod(),
          type,
          ex.getMessage());
    }
    return ResponseEntity.status(type.status())
        .body(ApiErrorResponse.of(type, ex.getMessage(), ex.getDetails()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    var fieldErrors = new LinkedHashMap<String, String>();
    ex.getBindingResult()
        .getFieldErrors()
        .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));
    log.warn("Validation failed: {}", fieldErrors);
    return ResponseEntity.status(ErrorType.VALIDATION_ERROR.status())
        .body(ApiErrorResponse.of(ErrorType.VALIDATION_ERROR, "Invalid request body", fieldErrors));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiErrorResponse> handleMalformedRequest(Exception ex) {
    log.warn("Malformed request: {}", ex.getMessage());
    return ResponseEntity.status(ErrorType.VALIDATION_ERROR.status())
        .body(ApiErrorResponse.of(ErrorType.VALIDATION_ERROR, "Malformed request"));
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn("Access denied: path={}, method={}", request.getRequestURI(), request.getMethod());
    return ResponseEntity.status(ErrorType.AUTHORIZATION_ERROR.status())
        .body(
            ApiErrorResponse.of(
                ErrorType.AUTHORIZATION_ERROR, "Insufficient permissions for this operation"));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex) {
    return ResponseEntity.status(ErrorType.NOT_FOUND.status())
        .body(ApiErrorResponse.of(ErrorType.NOT_FOUND, "No endpoint " + ex.getResourcePath()));
  }

  @ExceptionHandler({DataAccessException.class, TransactionException.class})
  public ResponseEntity<ApiErrorResponse> handleDataAccess(
      RuntimeException ex, HttpServletRequest request) {
    log.error("Unwrapped persistence failure on path={}", request.getRequestURI(), ex);
    return ResponseEntity.status(ErrorType.DATABASE_ERROR.status())
        .body(ApiErrorResponse.of(ErrorType.DATABASE_ERROR, "Database operation failed"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(
      Exception ex, HttpServletRequest request) {
    log.error("Unexpected error on path={}", request.getRequestURI(), ex);
    return ResponseEntity.status(ErrorType.INTERNAL_SERVER_ERROR.status())
        .body(ApiErrorResponse.of(ErrorType.INTERNAL_SERVER_ERROR, "Internal server error"));
  }
}

package io.b2mash.collab.exception;

import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Base for typed request failures. Each subclass fixes its {@link ErrorType} and HTTP status. */
public abstract class ApiException extends ErrorResponseException {

  private final ErrorType errorType;
  private final transient Object details;

  protected ApiException(ErrorType errorType, String title, String detail, Object details) {
    this(errorType, title, detail, details, null);
  }

  protected ApiException(
      ErrorType errorType, String title, String detail, Object details, Throwable cause) {
    super(errorType.status(), createProblem(errorType, title, detail), cause);
    this.errorType = errorType;
    this.details = details;
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public Object getDetails() {
    return details;
  }

  @Override
  public String getMessage() {
    String detail = getBody().getDetail();
    return detail != null ? detail : getBody().getTitle();
  }

  private static ProblemDetail createProblem(ErrorType errorType, String title, String detail) {
    var problem = ProblemDetail.forStatus(errorType.status());
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}

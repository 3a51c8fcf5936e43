package io.b2mash.collab.exception;

public class UnauthorizedException extends ApiException {

  public UnauthorizedException(String detail) {
    super(ErrorType.UNAUTHORIZED, "Unauthorized", detail, null);
  }
}

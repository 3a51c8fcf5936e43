package io.b2mash.collab.exception;

public class ForbiddenException extends ApiException {

  public ForbiddenException(String title, String detail) {
    super(ErrorType.AUTHORIZATION_ERROR, title, detail, null);
  }
}

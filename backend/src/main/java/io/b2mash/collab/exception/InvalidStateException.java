package io.b2mash.collab.exception;

/** A request that is well-formed but conflicts with the current state of the resource. */
public class InvalidStateException extends ApiException {

  public InvalidStateException(String title, String detail) {
    super(ErrorType.CONFLICT, title, detail, null);
  }
}

package io.b2mash.collab.exception;

public class ResourceNotFoundException extends ApiException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        ErrorType.NOT_FOUND,
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id,
        null);
  }

  private ResourceNotFoundException(String title, String detail) {
    super(ErrorType.NOT_FOUND, title, detail, null);
  }

  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail);
  }
}

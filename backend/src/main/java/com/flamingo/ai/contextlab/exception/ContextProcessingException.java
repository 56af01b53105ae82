package com.flamingo.ai.contextlab.exception;

/**
 * Exception thrown when a file cannot be loaded or parsed for its declared format.
 *
 * <p>Processors throw it internally; it never crosses a processor's {@code process} boundary.
 */
public class ContextProcessingException extends RuntimeException {

  private final String objectId;
  private final String contentPath;

  public ContextProcessingException(String objectId, String contentPath, String message) {
    super(message);
    this.objectId = objectId;
    this.contentPath = contentPath;
  }

  public ContextProcessingException(
      String objectId, String contentPath, String message, Throwable cause) {
    super(message, cause);
    this.objectId = objectId;
    this.contentPath = contentPath;
  }

  public String getObjectId() {
    return objectId;
  }

  public String getContentPath() {
    return contentPath;
  }
}

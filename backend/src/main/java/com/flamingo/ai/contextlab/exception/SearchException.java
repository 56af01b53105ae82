package com.flamingo.ai.contextlab.exception;

/** Exception thrown when the storage layer cannot answer a search or lookup. */
public class SearchException extends RuntimeException {

  public SearchException(String message) {
    super(message);
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
  }
}

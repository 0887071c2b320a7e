package com.flamingo.ai.researchchat.exception;

/** Exception thrown when a request payload is malformed or oversized. */
public class ValidationException extends RuntimeException {

  private final String field;

  public ValidationException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}

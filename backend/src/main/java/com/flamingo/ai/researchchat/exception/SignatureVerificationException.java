package com.flamingo.ai.researchchat.exception;

/** Exception thrown when a persisted payload fails signature verification. */
public class SignatureVerificationException extends RuntimeException {

  public SignatureVerificationException(String message) {
    super(message);
  }
}

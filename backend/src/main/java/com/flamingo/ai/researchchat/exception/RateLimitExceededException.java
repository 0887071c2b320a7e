package com.flamingo.ai.researchchat.exception;

/** Exception thrown when a client exhausts its request budget for a route. */
public class RateLimitExceededException extends RuntimeException {

  private final long retryAfterSeconds;

  public RateLimitExceededException(String key, long retryAfterSeconds) {
    super("Rate limit exceeded for " + key);
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}

package com.flamingo.ai.researchchat.exception;

import java.util.Locale;

/** Exception thrown when no generation model could produce an answer. */
public class LlmServiceException extends RuntimeException {

  private static final String UNAVAILABLE =
      "The AI service is temporarily unavailable. Please try again later.";

  private final String model;
  private final boolean rateLimited;

  public LlmServiceException(String model, String message, Throwable cause) {
    super(model + ": " + message, cause);
    this.model = model;
    this.rateLimited = isRateLimit(cause);
  }

  public String getModel() {
    return model;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return rateLimited ? "Service is temporarily busy. Please try again in a moment." : UNAVAILABLE;
  }

  private static boolean isRateLimit(Throwable cause) {
    String text = cause != null && cause.getMessage() != null ? cause.getMessage() : "";
    return text.contains("429") || text.toLowerCase(Locale.ROOT).contains("rate limit");
  }
}

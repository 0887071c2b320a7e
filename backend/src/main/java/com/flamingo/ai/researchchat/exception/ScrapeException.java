package com.flamingo.ai.researchchat.exception;

/** Exception thrown when a single page cannot be fetched or condensed. */
public class ScrapeException extends RuntimeException {

  private final String url;
  private final boolean blocked;
  private final String userMessage;

  public ScrapeException(String url, String message) {
    this(url, message, false, null);
  }

  public ScrapeException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
    this.blocked = false;
    this.userMessage = "Failed to read the requested page.";
  }

  private ScrapeException(String url, String message, boolean blocked, Throwable cause) {
    super(message, cause);
    this.url = url;
    this.blocked = blocked;
    this.userMessage =
        blocked ? "The requested address is not allowed." : "Failed to read the requested page.";
  }

  /** Creates an exception for a target rejected by the network safety rules. */
  public static ScrapeException blocked(String url, String reason) {
    return new ScrapeException(url, "Blocked target " + url + ": " + reason, true, null);
  }

  public String getUrl() {
    return url;
  }

  public boolean isBlocked() {
    return blocked;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

package com.flamingo.ai.researchchat.exception;

import java.time.Duration;

/** Exception raised when a stream receives no chunk within the inactivity window. */
public class StreamTimeoutException extends RuntimeException {

  public StreamTimeoutException(Duration inactivity) {
    super("Stream timed out after " + inactivity.toSeconds() + "s without activity");
  }
}

package com.flamingo.ai.researchchat.exception;

/** Exception thrown when a search or generation backend fails. */
public class ProviderException extends RuntimeException {

  private final String provider;

  public ProviderException(String provider, String message) {
    super(provider + ": " + message);
    this.provider = provider;
  }

  public ProviderException(String provider, String message, Throwable cause) {
    super(provider + ": " + message, cause);
    this.provider = provider;
  }

  public String getProvider() {
    return provider;
  }
}

package com.flamingo.ai.researchchat.service.scrape;

import java.net.URI;
import java.util.Locale;

/**
 * Raw HTTP response for a page fetch.
 *
 * @param uri requested URI
 * @param status HTTP status code
 * @param contentType response content type, empty when absent
 * @param location redirect target, {@code null} when absent
 * @param body response body, empty for redirects and non-HTML responses
 */
public record FetchedPage(URI uri, int status, String contentType, String location, String body) {

  public boolean isRedirect() {
    return status >= 300 && status < 400 && location != null && !location.isBlank();
  }

  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }

  public boolean isHtml() {
    return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html");
  }
}

package com.flamingo.ai.researchchat.service.scrape;

import java.net.URI;
import java.time.Duration;

/** Fetches a validated page. Redirect targets are validated again before they are followed. */
public interface PageFetcher {

  FetchedPage fetch(URI uri, Duration timeout);
}

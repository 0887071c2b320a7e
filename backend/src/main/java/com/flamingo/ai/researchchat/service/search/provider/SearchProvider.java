package com.flamingo.ai.researchchat.service.search.provider;

import java.time.Duration;

/**
 * One backend in the search provider chain.
 *
 * <p>Implementations are tried in {@link org.springframework.core.annotation.Order} order. A
 * call either returns results or throws a {@code ProviderException}.
 */
public interface SearchProvider {

  String USER_AGENT = "SearchChat/1.0 (Web Search Assistant)";

  /** Short identifier recorded in provider attempts and metrics. */
  String name();

  /** Whether the provider has the credentials it needs. */
  boolean isConfigured();

  ProviderResult search(String query, int maxResults, Duration timeout);
}

package com.flamingo.ai.researchchat.service.search;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.service.cache.ExpiringCache;
import com.flamingo.ai.researchchat.service.search.provider.ProviderResult;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Short-lived cache of provider chain outcomes keyed by {@code query|maxResults}. */
@Component
public class SearchCache {

  private static final long MAX_ENTRIES = 1_000;

  private final ExpiringCache<String, ProviderResult> results;
  private final ResearchConfig researchConfig;

  public SearchCache(Ticker ticker, ResearchConfig researchConfig) {
    this.results = new ExpiringCache<>(MAX_ENTRIES, ticker);
    this.researchConfig = researchConfig;
  }

  public Optional<ProviderResult> get(String query, int maxResults) {
    return results.get(key(query, maxResults));
  }

  public void put(String query, int maxResults, ProviderResult result) {
    results.put(
        key(query, maxResults),
        result,
        Duration.ofMillis(researchConfig.getSearch().getCacheTtlMs()));
  }

  private static String key(String query, int maxResults) {
    return query + "|" + maxResults;
  }
}

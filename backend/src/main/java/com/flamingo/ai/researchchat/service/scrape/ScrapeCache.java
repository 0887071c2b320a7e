package com.flamingo.ai.researchchat.service.scrape;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.service.cache.ExpiringCache;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Bounded cache of scraped pages. Failures are remembered briefly so retries back off. */
@Component
public class ScrapeCache {

  private final ExpiringCache<String, ScrapedSource> pages;
  private final ResearchConfig researchConfig;

  public ScrapeCache(Ticker ticker, ResearchConfig researchConfig) {
    this.pages = new ExpiringCache<>(researchConfig.getScrape().getCacheMaxEntries(), ticker);
    this.researchConfig = researchConfig;
  }

  public Optional<ScrapedSource> get(String url) {
    return pages.get(url);
  }

  public void put(String url, ScrapedSource source) {
    ResearchConfig.Scrape config = researchConfig.getScrape();
    long ttlMs = source.isFailed() ? config.getErrorCacheTtlMs() : config.getCacheTtlMs();
    pages.put(url, source, Duration.ofMillis(ttlMs));
  }
}

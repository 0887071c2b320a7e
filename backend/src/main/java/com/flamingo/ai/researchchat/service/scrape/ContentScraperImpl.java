package com.flamingo.ai.researchchat.service.scrape;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.exception.ScrapeException;
import com.flamingo.ai.researchchat.service.search.UrlNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Scrapes the top results in parallel on the scrape executor.
 *
 * <p>Page timing is recorded on a registry timer rather than through {@code @Timed}, since
 * {@link #scrapeAll} reaches {@link #scrape} without passing the proxy.
 */
@Service
@Slf4j
public class ContentScraperImpl implements ContentScraper {

  private final SsrfGuard ssrfGuard;
  private final PageFetcher pageFetcher;
  private final HtmlContentExtractor extractor;
  private final ScrapeCache scrapeCache;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;
  private final Executor scrapeExecutor;
  private final Timer pageTimer;

  public ContentScraperImpl(
      SsrfGuard ssrfGuard,
      PageFetcher pageFetcher,
      HtmlContentExtractor extractor,
      ScrapeCache scrapeCache,
      ResearchConfig researchConfig,
      MeterRegistry meterRegistry,
      @Qualifier("scrapeExecutor") Executor scrapeExecutor) {
    this.ssrfGuard = ssrfGuard;
    this.pageFetcher = pageFetcher;
    this.extractor = extractor;
    this.scrapeCache = scrapeCache;
    this.researchConfig = researchConfig;
    this.meterRegistry = meterRegistry;
    this.scrapeExecutor = scrapeExecutor;
    this.pageTimer =
        Timer.builder("scrape.page")
            .description("Time to scrape a single page")
            .register(meterRegistry);
  }

  @Override
  public ScrapedSource scrape(String url) {
    return pageTimer.record(() -> timedScrape(url));
  }

  private ScrapedSource timedScrape(String url) {
    URI target = ssrfGuard.validate(url);
    String key = target.toString();

    Optional<ScrapedSource> cached = scrapeCache.get(key);
    if (cached.isPresent()) {
      meterRegistry.counter("scrape.cache.hits").increment();
      if (cached.get().isFailed()) {
        throw new ScrapeException(url, cached.get().fetchError());
      }
      return cached.get();
    }

    try {
      FetchedPage page =
          pageFetcher.fetch(target, Duration.ofMillis(researchConfig.getScrape().getTimeoutMs()));
      if (!page.isSuccess()) {
        throw new ScrapeException(url, "HTTP " + page.status());
      }
      if (!page.isHtml()) {
        throw new ScrapeException(url, "Not an HTML page. Content-Type: " + page.contentType());
      }
      ScrapedSource source = extractor.extract(page.body(), key);
      scrapeCache.put(key, source);
      meterRegistry.counter("scrape.success").increment();
      return source;
    } catch (ScrapeException e) {
      if (!e.isBlocked()) {
        scrapeCache.put(key, ScrapedSource.failed(key, e.getMessage()));
      }
      meterRegistry.counter("scrape.failures").increment();
      throw e;
    }
  }

  @Override
  public List<ScrapedSource> scrapeAll(List<SearchResult> results) {
    List<SearchResult> selected =
        results.stream()
            .filter(result -> result != null && UrlNormalizer.isHttpUrl(result.url()))
            .limit(researchConfig.getScrape().getMaxSources())
            .toList();
    if (selected.isEmpty()) {
      return List.of();
    }
    log.debug("Scraping {} sources", selected.size());

    long waitMs = researchConfig.getScrape().getTimeoutMs() * 2;
    List<CompletableFuture<ScrapedSource>> futures =
        selected.stream()
            .map(
                result ->
                    CompletableFuture.supplyAsync(() -> scrapeOrSnippet(result), scrapeExecutor)
                        .completeOnTimeout(
                            ScrapedSource.fromSnippet(result, "Timed out"),
                            waitMs,
                            TimeUnit.MILLISECONDS))
            .toList();
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private ScrapedSource scrapeOrSnippet(SearchResult result) {
    try {
      return scrape(result.url());
    } catch (ScrapeException e) {
      log.warn("Using snippet for {}: {}", result.url(), e.getMessage());
      return ScrapedSource.fromSnippet(result, e.getUserMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected scrape failure for {}", result.url(), e);
      return ScrapedSource.fromSnippet(result, "Failed to read the requested page.");
    }
  }
}

package com.flamingo.ai.researchchat.service.search;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.service.context.TextNormalizer;
import com.flamingo.ai.researchchat.service.search.provider.ProviderResult;
import com.flamingo.ai.researchchat.service.search.provider.SearchProvider;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Sequential provider chain with per-call timeouts, result caching and a last-resort link. */
@Service
@Slf4j
public class ProviderExecutorImpl implements ProviderExecutor {

  static final double FALLBACK_LINK_SCORE = 0.3;
  private static final int MAX_STANDALONE_RESULTS = 20;
  private static final int LOGGED_QUERY_CHARS = 50;

  private final List<SearchProvider> providers;
  private final SearchCache searchCache;
  private final QueryEnhancer queryEnhancer;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  public ProviderExecutorImpl(
      List<SearchProvider> providers,
      SearchCache searchCache,
      QueryEnhancer queryEnhancer,
      ResearchConfig researchConfig,
      MeterRegistry meterRegistry) {
    this.providers = List.copyOf(providers);
    this.searchCache = searchCache;
    this.queryEnhancer = queryEnhancer;
    this.researchConfig = researchConfig;
    this.meterRegistry = meterRegistry;
    log.info(
        "Search provider chain: {}", this.providers.stream().map(SearchProvider::name).toList());
  }

  @Override
  @Timed(value = "search.execute", description = "Time to run the search provider chain")
  public SearchExecutionResult execute(
      List<String> queries, String userMessage, String contextSummary) {
    List<String> enhanced =
        queries.stream()
            .map(query -> queryEnhancer.enhance(query, contextSummary))
            .filter(query -> !query.isEmpty())
            .distinct()
            .toList();
    ResearchConfig.Search config = researchConfig.getSearch();
    return run(enhanced, userMessage, config.getMaxResultsPerQuery(), config.getMaxResults());
  }

  @Override
  public SearchExecutionResult search(String query, int maxResults) {
    String normalized = TextNormalizer.collapseWhitespace(query);
    if (normalized.isEmpty()) {
      return SearchExecutionResult.empty();
    }
    int limit = Math.max(1, Math.min(MAX_STANDALONE_RESULTS, maxResults));
    return run(List.of(normalized), normalized, limit, limit);
  }

  private SearchExecutionResult run(
      List<String> queries, String userMessage, int perQueryResults, int limit) {
    if (queries.isEmpty()) {
      return SearchExecutionResult.empty();
    }
    List<ProviderAttempt> attempts = new ArrayList<>();
    Map<String, SearchResult> merged = new LinkedHashMap<>();
    boolean hasRealResults = false;
    for (String query : queries) {
      ProviderResult result = runChain(query, perQueryResults, attempts);
      hasRealResults |= result.realResults() && !result.results().isEmpty();
      mergeInto(merged, result.results());
    }

    if (merged.isEmpty()) {
      log.warn("Every search provider failed for {} queries, using a search link", queries.size());
      meterRegistry.counter("search.fallback").increment();
      return new SearchExecutionResult(List.of(fallbackLink(queries.get(0))), false, attempts);
    }

    List<SearchResult> ranked =
        ResultReranker.rerank(new ArrayList<>(merged.values()), userMessage, limit);
    log.debug(
        "Search finished: queries={}, merged={}, returned={}, real={}",
        queries.size(),
        merged.size(),
        ranked.size(),
        hasRealResults);
    return new SearchExecutionResult(ranked, hasRealResults, attempts);
  }

  private ProviderResult runChain(String query, int maxResults, List<ProviderAttempt> attempts) {
    Optional<ProviderResult> cached = searchCache.get(query, maxResults);
    if (cached.isPresent()) {
      meterRegistry.counter("search.cache.hits").increment();
      attempts.add(
          ProviderAttempt.success(
              query,
              ProviderAttempt.CACHE,
              cached.get().results().size(),
              cached.get().realResults(),
              0));
      return cached.get();
    }

    Duration timeout = Duration.ofMillis(researchConfig.getSearch().getProviderTimeoutMs());
    for (SearchProvider provider : providers) {
      if (!provider.isConfigured()) {
        attempts.add(ProviderAttempt.failure(query, provider.name(), 0, "not configured"));
        continue;
      }
      long start = System.nanoTime();
      try {
        ProviderResult result = provider.search(query, maxResults, timeout);
        long durationMs = elapsedMs(start);
        if (result == null || result.results().isEmpty()) {
          attempts.add(ProviderAttempt.failure(query, provider.name(), durationMs, "no results"));
          continue;
        }
        attempts.add(
            ProviderAttempt.success(
                query, provider.name(), result.results().size(), result.realResults(), durationMs));
        meterRegistry.counter("search.provider.success", "provider", provider.name()).increment();
        searchCache.put(query, maxResults, result);
        return result;
      } catch (RuntimeException e) {
        long durationMs = elapsedMs(start);
        attempts.add(ProviderAttempt.failure(query, provider.name(), durationMs, e.getMessage()));
        meterRegistry.counter("search.provider.failures", "provider", provider.name()).increment();
        log.warn(
            "Search provider {} failed for '{}': {}",
            provider.name(),
            TextNormalizer.truncate(query, LOGGED_QUERY_CHARS),
            e.getMessage());
      }
    }
    return new ProviderResult(List.of(), false);
  }

  /** Adds {@code results} to {@code merged}, keeping the higher score for duplicate URLs. */
  static void mergeInto(Map<String, SearchResult> merged, List<SearchResult> results) {
    for (SearchResult result : results) {
      if (result == null || !UrlNormalizer.isHttpUrl(result.url())) {
        continue;
      }
      Object rawScore = result.relevanceScore();
      SearchResult sanitized = result.withRelevanceScore(RelevanceScores.sanitize(rawScore));
      merged.merge(
          UrlNormalizer.normalizeKey(result.url()), sanitized, ProviderExecutorImpl::higher);
    }
  }

  private static SearchResult higher(SearchResult existing, SearchResult candidate) {
    return candidate.scoreOr(-1.0) > existing.scoreOr(-1.0) ? candidate : existing;
  }

  static SearchResult fallbackLink(String query) {
    String encoded = URLEncoder.encode(query, StandardCharsets.UTF_8).replace("+", "%20");
    return new SearchResult(
        query + " - Search Results",
        "https://duckduckgo.com/?q=" + encoded,
        "Search results could not be retrieved. Try searching for \"" + query + "\" directly.",
        FALLBACK_LINK_SCORE);
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}

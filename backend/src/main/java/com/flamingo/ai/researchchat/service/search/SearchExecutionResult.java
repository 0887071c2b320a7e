package com.flamingo.ai.researchchat.service.search;

import com.flamingo.ai.researchchat.domain.model.SearchResult;
import java.util.List;

/**
 * Merged output of the provider chain across all planned queries.
 *
 * @param results deduplicated, reranked results
 * @param hasRealResults whether at least one provider call returned non-fallback results
 * @param attempts every provider call made, in order
 */
public record SearchExecutionResult(
    List<SearchResult> results, boolean hasRealResults, List<ProviderAttempt> attempts) {

  public SearchExecutionResult {
    results = List.copyOf(results);
    attempts = List.copyOf(attempts);
  }

  public static SearchExecutionResult empty() {
    return new SearchExecutionResult(List.of(), false, List.of());
  }

  public boolean isEmpty() {
    return results.isEmpty();
  }
}

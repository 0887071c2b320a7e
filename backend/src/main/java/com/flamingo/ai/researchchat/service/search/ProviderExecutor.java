package com.flamingo.ai.researchchat.service.search;

import java.util.List;

/** Runs search queries through the ordered provider chain. */
public interface ProviderExecutor {

  /**
   * Enhances and runs every query, then merges, deduplicates and reranks the results against
   * {@code userMessage}. A query whose providers all fail contributes nothing; it never aborts the
   * other queries.
   */
  SearchExecutionResult execute(List<String> queries, String userMessage, String contextSummary);

  /** Runs a single query as given, returning at most {@code maxResults} results. */
  SearchExecutionResult search(String query, int maxResults);
}

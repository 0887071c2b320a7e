package com.flamingo.ai.researchchat.service.search;

/**
 * Outcome of one provider call for one query.
 *
 * @param query the query as sent to the provider
 * @param provider provider name, or {@code cache} for a cached outcome
 * @param success whether the call produced results
 * @param resultCount number of results returned
 * @param realResults whether the results were real hits rather than generic links
 * @param durationMs wall time of the call
 * @param error failure reason, {@code null} on success
 */
public record ProviderAttempt(
    String query,
    String provider,
    boolean success,
    int resultCount,
    boolean realResults,
    long durationMs,
    String error) {

  static final String CACHE = "cache";

  public static ProviderAttempt success(
      String query, String provider, int resultCount, boolean realResults, long durationMs) {
    return new ProviderAttempt(query, provider, true, resultCount, realResults, durationMs, null);
  }

  public static ProviderAttempt failure(
      String query, String provider, long durationMs, String error) {
    return new ProviderAttempt(query, provider, false, 0, false, durationMs, error);
  }
}

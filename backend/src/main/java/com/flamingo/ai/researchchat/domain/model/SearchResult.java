package com.flamingo.ai.researchchat.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single web search hit.
 *
 * @param title display title
 * @param url absolute http(s) URL
 * @param snippet short excerpt from the provider
 * @param relevanceScore score in [0,1]; {@code null} when the provider gave no usable score
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResult(String title, String url, String snippet, Double relevanceScore) {

  /** Returns the score, or {@code fallback} when absent. */
  public double scoreOr(double fallback) {
    return relevanceScore != null ? relevanceScore : fallback;
  }

  public SearchResult withRelevanceScore(Double score) {
    return new SearchResult(title, url, snippet, score);
  }
}

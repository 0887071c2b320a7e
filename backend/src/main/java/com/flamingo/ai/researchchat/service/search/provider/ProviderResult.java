package com.flamingo.ai.researchchat.service.search.provider;

import com.flamingo.ai.researchchat.domain.model.SearchResult;
import java.util.List;

/**
 * Results returned by a single provider call.
 *
 * @param results parsed results, possibly empty
 * @param realResults {@code false} when the provider only produced generic search links
 */
public record ProviderResult(List<SearchResult> results, boolean realResults) {

  public ProviderResult {
    results = results == null ? List.of() : List.copyOf(results);
  }
}

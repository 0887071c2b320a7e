package com.flamingo.ai.researchchat.api.dto.response;

import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.service.search.ProviderAttempt;
import com.flamingo.ai.researchchat.service.search.SearchExecutionResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a standalone web search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private String query;
  private List<SearchResult> results;
  private boolean hasRealResults;
  private List<ProviderAttempt> attempts;

  public static SearchResponse from(String query, SearchExecutionResult result) {
    return SearchResponse.builder()
        .query(query)
        .results(result.results())
        .hasRealResults(result.hasRealResults())
        .attempts(result.attempts())
        .build();
  }
}

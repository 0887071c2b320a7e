package com.flamingo.ai.researchchat.api.rest;

import com.flamingo.ai.researchchat.api.dto.request.SearchRequest;
import com.flamingo.ai.researchchat.api.dto.response.SearchResponse;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.service.search.ProviderExecutor;
import com.flamingo.ai.researchchat.service.search.SearchExecutionResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller running one query through the search provider chain. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

  private final ProviderExecutor providerExecutor;
  private final ResearchConfig researchConfig;

  @PostMapping
  public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
    int maxResults =
        request.getMaxResults() != null
            ? request.getMaxResults()
            : researchConfig.getSearch().getMaxResults();
    String query = request.getQuery().trim();
    SearchExecutionResult result = providerExecutor.search(query, maxResults);
    return ResponseEntity.ok(SearchResponse.from(query, result));
  }
}

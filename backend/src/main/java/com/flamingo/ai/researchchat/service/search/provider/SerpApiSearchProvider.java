package com.flamingo.ai.researchchat.service.search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.exception.ProviderException;
import com.flamingo.ai.researchchat.service.search.UrlNormalizer;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

/** Google organic results through SerpAPI. First in the chain. */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class SerpApiSearchProvider implements SearchProvider {

  static final double ORGANIC_SCORE = 0.9;

  private final SearchHttpClient httpClient;
  private final ResearchConfig researchConfig;

  @Override
  public String name() {
    return "serpapi";
  }

  @Override
  public boolean isConfigured() {
    return StringUtils.hasText(researchConfig.getSearch().getSerpApiKey());
  }

  @Override
  public ProviderResult search(String query, int maxResults, Duration timeout) {
    ResearchConfig.Search config = researchConfig.getSearch();
    URI uri =
        UriComponentsBuilder.fromUriString(config.getSerpApiUrl())
            .queryParam("engine", "google")
            .queryParam("q", query)
            .queryParam("api_key", config.getSerpApiKey())
            .queryParam("hl", "en")
            .queryParam("gl", "us")
            .queryParam("num", maxResults)
            .build()
            .encode()
            .toUri();
    log.debug("SerpAPI request: queryLength={}, maxResults={}", query.length(), maxResults);

    JsonNode body = httpClient.getJson(name(), uri, timeout);
    if (body.hasNonNull("error")) {
      throw new ProviderException(name(), body.path("error").asText());
    }
    return new ProviderResult(parse(body, maxResults), true);
  }

  static List<SearchResult> parse(JsonNode body, int maxResults) {
    List<SearchResult> results = new ArrayList<>();
    for (JsonNode item : body.path("organic_results")) {
      if (results.size() >= maxResults) {
        break;
      }
      String link = item.path("link").asText("");
      if (!UrlNormalizer.isHttpUrl(link)) {
        continue;
      }
      results.add(
          new SearchResult(
              item.path("title").asText(link),
              link,
              item.path("snippet").asText(""),
              ORGANIC_SCORE));
    }
    return results;
  }
}

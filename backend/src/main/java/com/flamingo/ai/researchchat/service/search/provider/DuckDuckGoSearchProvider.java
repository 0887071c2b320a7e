package com.flamingo.ai.researchchat.service.search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.service.search.UrlNormalizer;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/** DuckDuckGo instant answers. Needs no key and is last in the chain. */
@Component
@Order(3)
@RequiredArgsConstructor
public class DuckDuckGoSearchProvider implements SearchProvider {

  static final double RELATED_TOPIC_SCORE = 0.7;
  static final double ABSTRACT_SCORE = 0.8;
  static final double WIKIPEDIA_LINK_SCORE = 0.6;
  static final double SEARCH_LINK_SCORE = 0.4;

  /** Results at or below this score are generic links rather than real hits. */
  static final double REAL_RESULT_THRESHOLD = 0.6;

  private final SearchHttpClient httpClient;
  private final ResearchConfig researchConfig;

  @Override
  public String name() {
    return "duckduckgo";
  }

  @Override
  public boolean isConfigured() {
    return true;
  }

  @Override
  public ProviderResult search(String query, int maxResults, Duration timeout) {
    URI uri =
        UriComponentsBuilder.fromUriString(researchConfig.getSearch().getDuckDuckGoUrl())
            .queryParam("q", query)
            .queryParam("format", "json")
            .queryParam("no_html", 1)
            .queryParam("skip_disambig", 1)
            .build()
            .encode()
            .toUri();
    JsonNode body = httpClient.getJson(name(), uri, timeout);
    List<SearchResult> results = parse(body, query, maxResults);
    boolean real = results.stream().anyMatch(r -> r.scoreOr(0.0) > REAL_RESULT_THRESHOLD);
    return new ProviderResult(results, real);
  }

  static List<SearchResult> parse(JsonNode body, String query, int maxResults) {
    List<SearchResult> results = new ArrayList<>();
    for (JsonNode topic : body.path("RelatedTopics")) {
      if (results.size() >= maxResults) {
        break;
      }
      String url = topic.path("FirstURL").asText("");
      String text = topic.path("Text").asText("");
      if (text.isEmpty() || !UrlNormalizer.isHttpUrl(url)) {
        continue;
      }
      String title = text.split(" - ")[0];
      results.add(
          new SearchResult(
              title.isBlank() ? text.substring(0, Math.min(100, text.length())) : title,
              url,
              text,
              RELATED_TOPIC_SCORE));
    }

    String abstractUrl = body.path("AbstractURL").asText("");
    String abstractText = body.path("Abstract").asText("");
    if (results.isEmpty() && !abstractText.isEmpty() && UrlNormalizer.isHttpUrl(abstractUrl)) {
      String heading = body.path("Heading").asText("");
      results.add(
          new SearchResult(
              heading.isEmpty() ? query : heading, abstractUrl, abstractText, ABSTRACT_SCORE));
    }

    if (results.isEmpty()) {
      List<SearchResult> links = searchLinks(query);
      return links.subList(0, Math.min(2, Math.max(1, maxResults)));
    }
    return results;
  }

  private static List<SearchResult> searchLinks(String query) {
    String encoded = URLEncoder.encode(query, StandardCharsets.UTF_8).replace("+", "%20");
    return List.of(
        new SearchResult(
            query + " - Wikipedia",
            "https://en.wikipedia.org/wiki/Special:Search/" + encoded,
            "Wikipedia search results for \"" + query + "\"",
            WIKIPEDIA_LINK_SCORE),
        new SearchResult(
            query + " - Search Results",
            "https://duckduckgo.com/?q=" + encoded,
            "Web search results for \"" + query + "\"",
            SEARCH_LINK_SCORE));
  }
}

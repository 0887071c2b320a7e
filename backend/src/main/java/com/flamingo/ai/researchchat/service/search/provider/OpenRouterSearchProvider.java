package com.flamingo.ai.researchchat.service.search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.service.search.UrlNormalizer;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Search through an online model on OpenRouter.
 *
 * <p>Citations come from the response annotations when present, otherwise from URLs found in the
 * answer text.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class OpenRouterSearchProvider implements SearchProvider {

  static final double ANNOTATED_SCORE = 0.85;
  static final double EXTRACTED_SCORE = 0.75;

  private static final String SYSTEM_PROMPT =
      "You are a web search assistant. Provide factual information with sources. "
          + "Always cite your sources with URLs.";
  private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s)\\]>\"]+");
  private static final int SNIPPET_CHARS = 200;

  private final SearchHttpClient httpClient;
  private final ResearchConfig researchConfig;

  @Override
  public String name() {
    return "openrouter";
  }

  @Override
  public boolean isConfigured() {
    return StringUtils.hasText(researchConfig.getSearch().getOpenRouterApiKey());
  }

  @Override
  public ProviderResult search(String query, int maxResults, Duration timeout) {
    ResearchConfig.Search config = researchConfig.getSearch();
    Map<String, Object> request =
        Map.of(
            "model", config.getOpenRouterSearchModel(),
            "messages",
                List.of(
                    Map.of("role", "system", "content", SYSTEM_PROMPT),
                    Map.of(
                        "role",
                        "user",
                        "content",
                        "Search for: " + query + ". Provide key information with source URLs.")),
            "max_tokens", 1000,
            "temperature", 0.1);

    JsonNode body =
        httpClient.postJson(
            name(),
            URI.create(config.getOpenRouterUrl()),
            config.getOpenRouterApiKey(),
            request,
            timeout);
    return new ProviderResult(parse(body, query, maxResults), true);
  }

  static List<SearchResult> parse(JsonNode body, String query, int maxResults) {
    JsonNode message = body.path("choices").path(0).path("message");
    String content = message.path("content").asText("");

    List<SearchResult> results = new ArrayList<>();
    int index = 0;
    for (JsonNode annotation : message.path("annotations")) {
      index++;
      JsonNode citation = annotation.path("url_citation");
      String url = citation.path("url").asText("");
      if (!"url_citation".equals(annotation.path("type").asText())
          || !UrlNormalizer.isHttpUrl(url)) {
        continue;
      }
      String snippet = citation.path("content").asText("");
      if (snippet.isEmpty()) {
        snippet =
            excerpt(
                content,
                citation.path("start_index").asInt(0),
                citation.path("end_index").asInt(SNIPPET_CHARS));
      }
      results.add(
          new SearchResult(
              citation.path("title").asText("Search Result " + index),
              url,
              snippet,
              ANNOTATED_SCORE));
    }

    if (results.isEmpty() && !content.isEmpty()) {
      String snippet = content.substring(0, Math.min(SNIPPET_CHARS, content.length())) + "...";
      int position = 0;
      for (String url : extractUrls(content)) {
        if (position >= maxResults) {
          break;
        }
        position++;
        results.add(
            new SearchResult(
                "Search Result " + position + " for: " + query,
                url,
                snippet,
                EXTRACTED_SCORE));
      }
    }
    return results.size() > maxResults ? results.subList(0, maxResults) : results;
  }

  private static Set<String> extractUrls(String content) {
    Set<String> urls = new LinkedHashSet<>();
    Matcher matcher = URL_PATTERN.matcher(content);
    while (matcher.find()) {
      String url = matcher.group().replaceAll("[.,;:!?']+$", "");
      if (UrlNormalizer.isHttpUrl(url)) {
        urls.add(url);
      }
    }
    return urls;
  }

  private static String excerpt(String content, int start, int end) {
    int from = Math.max(0, Math.min(start, content.length()));
    int to = Math.max(from, Math.min(end, content.length()));
    return content.substring(from, to);
  }
}

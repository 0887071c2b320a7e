package com.flamingo.ai.researchchat.service.scrape;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.researchchat.domain.model.SearchResult;

/**
 * A page condensed for the prompt, or the search snippet that stands in for it.
 *
 * @param url page URL
 * @param title page title
 * @param content cleaned main text
 * @param summary leading excerpt of {@code content}
 * @param fetchError why the page could not be read, {@code null} on success
 * @param needsJsRendering whether the page looks like a client-rendered app
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScrapedSource(
    String url,
    String title,
    String content,
    String summary,
    String fetchError,
    boolean needsJsRendering) {

  /** Uses the search snippet in place of page content after a failed fetch. */
  public static ScrapedSource fromSnippet(SearchResult result, String error) {
    String snippet = result.snippet() == null ? "" : result.snippet();
    return new ScrapedSource(result.url(), result.title(), snippet, snippet, error, false);
  }

  static ScrapedSource failed(String url, String error) {
    return new ScrapedSource(url, null, "", "", error, false);
  }

  @JsonIgnore
  public boolean isFailed() {
    return fetchError != null;
  }
}

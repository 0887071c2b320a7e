package com.flamingo.ai.researchchat.service.generation;

import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.service.search.UrlNormalizer;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/** Builds an answer straight from search snippets when no model could respond. */
final class SnippetAnswerSynthesizer {

  static final String NOTE =
      "*Note: AI processing is currently unavailable, but the above search results should help "
          + "answer your question.*";

  private SnippetAnswerSynthesizer() {}

  static String synthesize(List<SearchResult> results, String message, int maxChars) {
    if (results == null || results.isEmpty()) {
      return manualSearchAnswer(message);
    }
    String listing =
        results.stream()
            .map(r -> "**" + r.title() + "**\n" + citedSnippet(r))
            .collect(Collectors.joining("\n\n"));
    if (listing.length() > maxChars) {
      listing = listing.substring(0, maxChars) + "...";
    }
    return "Based on the search results I found:\n\n" + listing + "\n\n" + NOTE;
  }

  static String manualSearchAnswer(String message) {
    String encoded = URLEncoder.encode(message, StandardCharsets.UTF_8).replace("+", "%20");
    return "I'm having trouble generating a response right now.\n\n"
        + "Please try again later, or search manually for \""
        + message
        + "\" on:\n"
        + "- [Google](https://www.google.com/search?q="
        + encoded
        + ")\n"
        + "- [DuckDuckGo](https://duckduckgo.com/?q="
        + encoded
        + ")";
  }

  /** Snippet followed by the source domain in brackets, the citation form answers use. */
  private static String citedSnippet(SearchResult result) {
    String host = UrlNormalizer.host(result.url());
    String citation = "[" + (host.isEmpty() ? result.url() : host) + "]";
    String snippet = result.snippet() == null ? "" : result.snippet().trim();
    return snippet.isEmpty() ? citation : snippet + " " + citation;
  }
}

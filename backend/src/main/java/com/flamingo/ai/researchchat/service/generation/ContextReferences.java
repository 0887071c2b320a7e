package com.flamingo.ai.researchchat.service.generation;

import com.flamingo.ai.researchchat.domain.enums.ContextReferenceType;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.service.scrape.ScrapedSource;
import com.flamingo.ai.researchchat.service.search.UrlNormalizer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Builds provenance records for an answer. */
final class ContextReferences {

  private ContextReferences() {}

  /**
   * Merges client-supplied references with those derived from search and scraping. Later entries
   * for the same normalized URL replace earlier ones; client references without a URL are kept.
   */
  static List<ContextReference> build(
      List<ContextReference> clientReferences,
      List<SearchResult> results,
      List<ScrapedSource> scraped,
      long timestamp) {
    Map<String, ContextReference> byKey = new LinkedHashMap<>();
    List<ContextReference> withoutUrl = new ArrayList<>();
    for (ContextReference reference : clientReferences) {
      if (reference.url() == null) {
        withoutUrl.add(reference);
      } else {
        byKey.put(UrlNormalizer.normalizeKey(reference.url()), reference);
      }
    }
    for (SearchResult result : results) {
      String key = UrlNormalizer.normalizeKey(result.url());
      byKey.put(
          key,
          new ContextReference(
              contextId(key),
              ContextReferenceType.SEARCH_RESULT,
              result.url(),
              result.title(),
              timestamp,
              result.relevanceScore(),
              null));
    }
    for (ScrapedSource source : scraped) {
      if (source.isFailed()) {
        continue;
      }
      String key = UrlNormalizer.normalizeKey(source.url());
      ContextReference previous = byKey.get(key);
      byKey.put(
          key,
          new ContextReference(
              contextId(key),
              ContextReferenceType.SCRAPED_PAGE,
              source.url(),
              source.title(),
              timestamp,
              previous != null ? previous.relevanceScore() : null,
              Map.of("contentLength", source.content().length())));
    }
    List<ContextReference> merged = new ArrayList<>(withoutUrl);
    merged.addAll(byKey.values());
    return merged;
  }

  private static String contextId(String key) {
    return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
  }
}

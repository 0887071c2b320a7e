package com.flamingo.ai.researchchat.service.scrape;

import com.flamingo.ai.researchchat.domain.model.SearchResult;
import java.util.List;

/** Fetches and condenses result pages behind the network safety checks. */
public interface ContentScraper {

  /**
   * Scrapes one page.
   *
   * @throws com.flamingo.ai.researchchat.exception.ScrapeException when the target is blocked or
   *     cannot be read
   */
  ScrapedSource scrape(String url);

  /**
   * Scrapes the leading results concurrently. The returned list keeps the order of {@code
   * results}; a page that cannot be read is replaced by its search snippet.
   */
  List<ScrapedSource> scrapeAll(List<SearchResult> results);
}

package com.flamingo.ai.researchchat.api.rest;

import com.flamingo.ai.researchchat.api.dto.request.ScrapeRequest;
import com.flamingo.ai.researchchat.service.scrape.ContentScraper;
import com.flamingo.ai.researchchat.service.scrape.ScrapedSource;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller reading a single page through the scraper's network checks. */
@RestController
@RequestMapping("/api/scrape")
@RequiredArgsConstructor
public class ScrapeController {

  private final ContentScraper contentScraper;

  @PostMapping
  public ResponseEntity<ScrapedSource> scrape(@Valid @RequestBody ScrapeRequest request) {
    return ResponseEntity.ok(contentScraper.scrape(request.getUrl().trim()));
  }
}

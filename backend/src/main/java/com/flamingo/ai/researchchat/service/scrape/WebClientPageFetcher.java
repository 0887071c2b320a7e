package com.flamingo.ai.researchchat.service.scrape;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.exception.ScrapeException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/** {@link PageFetcher} on the shared {@link WebClient}, following at most three redirects. */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebClientPageFetcher implements PageFetcher {

  private static final int MAX_REDIRECTS = 3;
  private static final String ACCEPT =
      "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

  private final WebClient webClient;
  private final SsrfGuard ssrfGuard;
  private final ResearchConfig researchConfig;

  @Override
  public FetchedPage fetch(URI uri, Duration timeout) {
    URI current = uri;
    for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
      FetchedPage page = fetchOnce(current, timeout);
      if (!page.isRedirect()) {
        return page;
      }
      URI next = current.resolve(page.location().trim());
      log.debug("Following redirect {} -> {}", current, next);
      current = ssrfGuard.validate(next.toString());
    }
    throw new ScrapeException(uri.toString(), "Too many redirects");
  }

  private FetchedPage fetchOnce(URI uri, Duration timeout) {
    try {
      return webClient
          .get()
          .uri(uri)
          .header(HttpHeaders.USER_AGENT, researchConfig.getScrape().getUserAgent())
          .header(HttpHeaders.ACCEPT, ACCEPT)
          .header(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5")
          .exchangeToMono(response -> toPage(uri, response))
          .timeout(timeout)
          .block();
    } catch (RuntimeException e) {
      Throwable cause = Exceptions.unwrap(e);
      String reason =
          cause instanceof TimeoutException
              ? "Timed out after " + timeout.toMillis() + " ms"
              : "Fetch failed: " + cause.getMessage();
      throw new ScrapeException(uri.toString(), reason, cause);
    }
  }

  private static Mono<FetchedPage> toPage(URI uri, ClientResponse response) {
    int status = response.statusCode().value();
    String contentType = response.headers().contentType().map(MediaType::toString).orElse("");
    String location = response.headers().asHttpHeaders().getFirst(HttpHeaders.LOCATION);
    FetchedPage empty = new FetchedPage(uri, status, contentType, location, "");
    if (!response.statusCode().is2xxSuccessful() || !empty.isHtml()) {
      return response.releaseBody().thenReturn(empty);
    }
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(body -> new FetchedPage(uri, status, contentType, location, body));
  }
}

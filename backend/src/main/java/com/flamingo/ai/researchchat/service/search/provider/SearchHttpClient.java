package com.flamingo.ai.researchchat.service.search.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchchat.exception.ProviderException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/** Blocking JSON calls to search backends with a per-call timeout. */
@Component
@RequiredArgsConstructor
public class SearchHttpClient {

  private final WebClient webClient;
  private final ObjectMapper objectMapper;

  public JsonNode getJson(String provider, URI uri, Duration timeout) {
    return execute(
        provider,
        webClient.get().uri(uri).header(HttpHeaders.USER_AGENT, SearchProvider.USER_AGENT),
        timeout);
  }

  public JsonNode postJson(
      String provider, URI uri, String bearerToken, Object body, Duration timeout) {
    return execute(
        provider,
        webClient
            .post()
            .uri(uri)
            .header(HttpHeaders.USER_AGENT, SearchProvider.USER_AGENT)
            .headers(headers -> headers.setBearerAuth(bearerToken))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body),
        timeout);
  }

  private JsonNode execute(
      String provider, WebClient.RequestHeadersSpec<?> spec, Duration timeout) {
    String body;
    try {
      body = spec.retrieve().bodyToMono(String.class).timeout(timeout).block();
    } catch (WebClientResponseException e) {
      throw new ProviderException(provider, "HTTP " + e.getStatusCode().value(), e);
    } catch (RuntimeException e) {
      Throwable cause = Exceptions.unwrap(e);
      String reason =
          cause instanceof TimeoutException
              ? "timed out after " + timeout.toMillis() + " ms"
              : String.valueOf(cause.getMessage());
      throw new ProviderException(provider, reason, cause);
    }
    if (body == null || body.isBlank()) {
      throw new ProviderException(provider, "empty response");
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new ProviderException(provider, "malformed response", e);
    }
  }
}

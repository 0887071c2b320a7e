package com.flamingo.ai.researchchat.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.exception.RateLimitExceededException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

@DisplayName("RateLimitInterceptor")
class RateLimitInterceptorTest {

  private ResearchConfig researchConfig;
  private SimpleMeterRegistry meterRegistry;
  private RateLimitInterceptor interceptor;

  @BeforeEach
  void setUp() {
    researchConfig = new ResearchConfig();
    meterRegistry = new SimpleMeterRegistry();
    RateLimiter rateLimiter =
        new RateLimiter(Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC));
    interceptor = new RateLimitInterceptor(rateLimiter, researchConfig, meterRegistry);
  }

  private static MockHttpServletRequest post(String path, String client) {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", path);
    request.setRemoteAddr(client);
    return request;
  }

  @Test
  @DisplayName("Should reject the request after the route budget with a retry hint")
  void shouldRejectOverBudget() {
    // given
    for (int i = 0; i < 10; i++) {
      MockHttpServletResponse response = new MockHttpServletResponse();
      assertThat(
              interceptor.preHandle(post("/api/ai/agent/stream", "10.0.0.1"), response, null))
          .isTrue();
      assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo(String.valueOf(9 - i));
    }

    // when / then
    assertThatThrownBy(
            () ->
                interceptor.preHandle(
                    post("/api/ai/agent/stream", "10.0.0.1"), new MockHttpServletResponse(), null))
        .isInstanceOf(RateLimitExceededException.class)
        .satisfies(
            e ->
                assertThat(((RateLimitExceededException) e).getRetryAfterSeconds())
                    .isEqualTo(60));
    assertThat(
            meterRegistry.counter("ratelimit.rejected", "route", "/api/ai/agent/stream").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should keep separate budgets per client and per route")
  void shouldIsolateClientsAndRoutes() {
    // given
    researchConfig.getRateLimit().getRoutes().put("/api/scrape", 1);
    interceptor.preHandle(post("/api/scrape", "10.0.0.1"), new MockHttpServletResponse(), null);

    // when / then
    assertThat(
            interceptor.preHandle(
                post("/api/scrape", "10.0.0.2"), new MockHttpServletResponse(), null))
        .isTrue();
    assertThat(
            interceptor.preHandle(
                post("/api/search", "10.0.0.1"), new MockHttpServletResponse(), null))
        .isTrue();
  }

  @Test
  @DisplayName("Should key on the socket address and ignore client supplied forwarding headers")
  void shouldIgnoreSpoofedForwardedFor() {
    // given
    researchConfig.getRateLimit().getRoutes().put("/api/scrape", 1);
    interceptor.preHandle(post("/api/scrape", "198.51.100.4"), new MockHttpServletResponse(), null);
    MockHttpServletRequest spoofed = post("/api/scrape", "198.51.100.4");
    spoofed.addHeader("X-Forwarded-For", "203.0.113.7");
    spoofed.addHeader("X-Real-IP", "203.0.113.9");

    // when / then
    assertThatThrownBy(
            () -> interceptor.preHandle(spoofed, new MockHttpServletResponse(), null))
        .isInstanceOf(RateLimitExceededException.class);
    MockHttpServletRequest other = post("/api/scrape", "198.51.100.5");
    other.addHeader("X-Forwarded-For", "198.51.100.4");
    assertThat(interceptor.preHandle(other, new MockHttpServletResponse(), null)).isTrue();
  }

  @Test
  @DisplayName("Should pass preflight requests without spending budget")
  void shouldSkipPreflight() {
    // given
    MockHttpServletRequest options = new MockHttpServletRequest("OPTIONS", "/api/search");
    MockHttpServletResponse response = new MockHttpServletResponse();

    // when
    boolean proceed = interceptor.preHandle(options, response, null);

    // then
    assertThat(proceed).isTrue();
    assertThat(response.getHeader("X-RateLimit-Limit")).isNull();
  }

  @Test
  @DisplayName("Should resolve the longest configured prefix, then the handler pattern")
  void shouldResolveRoute() {
    MockHttpServletRequest sessions = post("/api/ai/agent/sessions/abc", "10.0.0.1");
    MockHttpServletRequest stream = post("/api/ai/agent/stream", "10.0.0.1");
    MockHttpServletRequest conversation = post("/api/conversations/123", "10.0.0.1");
    conversation.setAttribute(
        HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE, "/api/conversations/{id}");

    assertThat(interceptor.resolveRoute(sessions)).isEqualTo("/api/ai/agent");
    assertThat(interceptor.resolveRoute(stream)).isEqualTo("/api/ai/agent/stream");
    assertThat(interceptor.resolveRoute(conversation)).isEqualTo("/api/conversations/{id}");
  }
}

package com.flamingo.ai.researchchat.security;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.exception.RateLimitExceededException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Per-client, per-route request budget.
 *
 * <p>The route is the longest configured prefix of the request path, otherwise the matched handler
 * pattern, so path variables share one bucket.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitInterceptor implements HandlerInterceptor {

  static final String LIMIT_HEADER = "X-RateLimit-Limit";
  static final String REMAINING_HEADER = "X-RateLimit-Remaining";

  private final RateLimiter rateLimiter;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    if (HttpMethod.OPTIONS.matches(request.getMethod())) {
      return true;
    }
    ResearchConfig.RateLimit config = researchConfig.getRateLimit();
    String route = resolveRoute(request);
    int limit = config.limitFor(route);
    String client = ClientIpResolver.resolve(request);

    Duration window = Duration.ofMillis(config.getWindowMs());
    RateLimitDecision decision = rateLimiter.tryAcquire(client + ":" + route, limit, window);
    response.setHeader(LIMIT_HEADER, String.valueOf(limit));
    response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
    if (!decision.allowed()) {
      meterRegistry.counter("ratelimit.rejected", "route", route).increment();
      log.warn("Rate limit exceeded for route {} by {}", route, client);
      throw new RateLimitExceededException(route, decision.retryAfterSeconds());
    }
    return true;
  }

  String resolveRoute(HttpServletRequest request) {
    String path = request.getRequestURI();
    String best = null;
    for (Map.Entry<String, Integer> entry : researchConfig.getRateLimit().getRoutes().entrySet()) {
      String prefix = entry.getKey();
      boolean matches = path.equals(prefix) || path.startsWith(prefix + "/");
      if (matches && (best == null || prefix.length() > best.length())) {
        best = prefix;
      }
    }
    if (best != null) {
      return best;
    }
    Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    return pattern != null ? pattern.toString() : path;
  }
}

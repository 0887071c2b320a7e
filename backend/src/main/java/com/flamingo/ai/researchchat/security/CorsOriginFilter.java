package com.flamingo.ai.researchchat.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Strict origin check and CORS headers for every request.
 *
 * <p>A present origin must be allow-listed. A missing origin is accepted only on public paths,
 * which then get no CORS headers. Preflights are answered here with 204.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class CorsOriginFilter extends OncePerRequestFilter {

  static final String UNAUTHORIZED_BODY = "{\"error\":\"Unauthorized origin\"}";
  static final String ALLOWED_METHODS = "GET, POST, DELETE, OPTIONS";
  static final String MAX_AGE = "600";

  private final OriginGuard originGuard;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    response.addHeader(HttpHeaders.VARY, HttpHeaders.ORIGIN);
    String origin = request.getHeader(HttpHeaders.ORIGIN);

    if (origin == null) {
      if (originGuard.isPublicPath(request.getRequestURI())) {
        filterChain.doFilter(request, response);
      } else {
        reject(response);
      }
      return;
    }

    Optional<String> allowed = originGuard.validate(origin);
    if (allowed.isEmpty()) {
      reject(response);
      return;
    }
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, allowed.get());
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, ALLOWED_METHODS);
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "false");
    response.setHeader(HttpHeaders.ACCESS_CONTROL_MAX_AGE, MAX_AGE);

    if (isPreflight(request)) {
      String requested = request.getHeader(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS);
      response.setHeader(
          HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS,
          requested != null && !requested.isBlank() ? requested : HttpHeaders.CONTENT_TYPE);
      response.setStatus(HttpServletResponse.SC_NO_CONTENT);
      return;
    }
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, HttpHeaders.CONTENT_TYPE);
    filterChain.doFilter(request, response);
  }

  private static boolean isPreflight(HttpServletRequest request) {
    return HttpMethod.OPTIONS.matches(request.getMethod())
        && request.getHeader(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD) != null;
  }

  private static void reject(HttpServletResponse response) throws IOException {
    response.setStatus(HttpServletResponse.SC_FORBIDDEN);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.getWriter().write(UNAUTHORIZED_BODY);
  }
}

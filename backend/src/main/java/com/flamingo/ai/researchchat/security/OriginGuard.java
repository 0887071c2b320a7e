package com.flamingo.ai.researchchat.security;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates request origins against the configured allow-list.
 *
 * <p>Entries are exact origins ({@code https://app.example.com}) or wildcards ({@code
 * *.example.com}) matching the bare domain and any subdomain. Only {@code http} and {@code https}
 * origins without path or credentials are ever accepted. When a local development origin is
 * listed, the other common local dev-server origins are accepted too.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OriginGuard {

  static final Set<String> DEV_ORIGINS =
      Set.of(
          "http://localhost:5173",
          "http://localhost:5174",
          "http://127.0.0.1:5173",
          "http://127.0.0.1:5174",
          "https://localhost:5173",
          "https://localhost:5174",
          "http://localhost:4173",
          "http://127.0.0.1:4173",
          "https://localhost:4173");

  private final ResearchConfig researchConfig;

  /** Returns the canonical origin when it is allowed. */
  public Optional<String> validate(String origin) {
    Optional<String> canonical = canonicalize(origin);
    if (canonical.isEmpty()) {
      log.warn("Rejected malformed origin: {}", origin);
      return Optional.empty();
    }
    if (isAllowed(canonical.get(), allowList())) {
      return canonical;
    }
    log.warn("Rejected request from unauthorized origin: {}", origin);
    return Optional.empty();
  }

  /** Whether the path is public, so a missing origin is accepted. */
  public boolean isPublicPath(String path) {
    if (path == null) {
      return false;
    }
    for (String publicPath : researchConfig.getCors().getPublicPaths()) {
      if (publicPath.endsWith("/") ? path.startsWith(publicPath) : path.equals(publicPath)) {
        return true;
      }
    }
    return false;
  }

  static boolean isAllowed(String canonicalOrigin, Set<String> allowList) {
    if (allowList.contains(canonicalOrigin)) {
      return true;
    }
    String host = URI.create(canonicalOrigin).getHost();
    for (String entry : allowList) {
      if (entry.startsWith("*.")) {
        String domain = entry.substring(2);
        if (host.equals(domain) || host.endsWith("." + domain)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Lower-cased {@code scheme://host[:port]}, empty for anything else. */
  static Optional<String> canonicalize(String origin) {
    if (origin == null || origin.isBlank() || "null".equals(origin)) {
      return Optional.empty();
    }
    URI uri;
    try {
      uri = new URI(origin.trim());
    } catch (URISyntaxException e) {
      return Optional.empty();
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      return Optional.empty();
    }
    if (uri.getHost() == null
        || uri.getRawUserInfo() != null
        || uri.getRawQuery() != null
        || uri.getRawFragment() != null
        || (uri.getRawPath() != null && !uri.getRawPath().isEmpty())) {
      return Optional.empty();
    }
    String host = uri.getHost().toLowerCase(Locale.ROOT);
    String port = uri.getPort() == -1 ? "" : ":" + uri.getPort();
    return Optional.of(scheme + "://" + host + port);
  }

  private Set<String> allowList() {
    List<String> configured = researchConfig.getCors().getAllowedOrigins();
    Set<String> entries = new LinkedHashSet<>();
    boolean hasDevOrigin = false;
    for (String raw : configured) {
      String entry = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      if (entry.isEmpty()) {
        continue;
      }
      if (entry.startsWith("*.")) {
        entries.add(entry);
        continue;
      }
      Optional<String> canonical = canonicalize(entry);
      if (canonical.isPresent()) {
        entries.add(canonical.get());
        hasDevOrigin |= DEV_ORIGINS.contains(canonical.get());
      }
    }
    if (hasDevOrigin) {
      entries.addAll(DEV_ORIGINS);
    }
    return entries;
  }
}

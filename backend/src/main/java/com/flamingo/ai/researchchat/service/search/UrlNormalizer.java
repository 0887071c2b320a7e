package com.flamingo.ai.researchchat.service.search;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** URL helpers used to deduplicate and label search results. */
public final class UrlNormalizer {

  private static final Set<String> TRACKING_PARAMS =
      Set.of(
          "utm_source",
          "utm_medium",
          "utm_campaign",
          "utm_term",
          "utm_content",
          "gclid",
          "fbclid",
          "ref");

  private UrlNormalizer() {}

  /**
   * Returns the deduplication key for {@code url}.
   *
   * <p>The key ignores the scheme, lower-cases the host, drops a leading {@code www.}, removes
   * tracking parameters, the fragment and a trailing slash. Unparseable input falls back to the
   * trimmed string without its fragment.
   */
  public static String normalizeKey(String url) {
    if (url == null) {
      return "";
    }
    String trimmed = url.trim();
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException e) {
      return stripFragment(trimmed);
    }
    if (uri.getScheme() == null || uri.getHost() == null) {
      return stripFragment(trimmed);
    }

    StringBuilder key = new StringBuilder(stripWww(uri.getHost().toLowerCase(Locale.ROOT)));
    if (uri.getPort() != -1 && !isDefaultPort(uri)) {
      key.append(':').append(uri.getPort());
    }
    String path = uri.getRawPath() == null ? "" : uri.getRawPath();
    if (path.equals("/")) {
      path = "";
    } else if (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    key.append(path);

    String query = filterQuery(uri.getRawQuery());
    if (!query.isEmpty()) {
      key.append('?').append(query);
    }
    return key.toString();
  }

  /** Returns {@code true} when {@code url} is an absolute http or https URL with a host. */
  public static boolean isHttpUrl(String url) {
    if (url == null || url.isBlank()) {
      return false;
    }
    try {
      URI uri = new URI(url.trim());
      String scheme = uri.getScheme();
      return uri.getHost() != null
          && scheme != null
          && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"));
    } catch (URISyntaxException e) {
      return false;
    }
  }

  /** Lower-cased host without {@code www.}, or an empty string when it cannot be parsed. */
  public static String host(String url) {
    if (url == null) {
      return "";
    }
    try {
      String host = new URI(url.trim()).getHost();
      return host == null ? "" : stripWww(host.toLowerCase(Locale.ROOT));
    } catch (URISyntaxException e) {
      return "";
    }
  }

  private static String filterQuery(String rawQuery) {
    if (rawQuery == null || rawQuery.isEmpty()) {
      return "";
    }
    List<String> kept = new ArrayList<>();
    for (String pair : rawQuery.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String name = eq >= 0 ? pair.substring(0, eq) : pair;
      if (!TRACKING_PARAMS.contains(name.toLowerCase(Locale.ROOT))) {
        kept.add(pair);
      }
    }
    return String.join("&", kept);
  }

  private static boolean isDefaultPort(URI uri) {
    return (uri.getPort() == 80 && "http".equalsIgnoreCase(uri.getScheme()))
        || (uri.getPort() == 443 && "https".equalsIgnoreCase(uri.getScheme()));
  }

  private static String stripWww(String host) {
    return host.startsWith("www.") ? host.substring(4) : host;
  }

  private static String stripFragment(String value) {
    int hash = value.indexOf('#');
    return hash >= 0 ? value.substring(0, hash) : value;
  }
}

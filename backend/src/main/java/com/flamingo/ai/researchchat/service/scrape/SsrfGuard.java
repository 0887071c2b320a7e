package com.flamingo.ai.researchchat.service.scrape;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.exception.ScrapeException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Validates scrape targets before any connection is opened.
 *
 * <p>Only http and https URLs are allowed. The host is resolved and every address it maps to must
 * be publicly routable: loopback, link-local, private, CGNAT, {@code 0.0.0.0/8}, multicast,
 * unique-local IPv6 and IPv4 addresses embedded in IPv6 are all rejected, as are cloud metadata
 * endpoints. With {@code research.scrape.allow-private-network} only the metadata and scheme
 * checks remain.
 */
@Component
@Slf4j
public class SsrfGuard {

  private static final Set<String> METADATA_HOSTS =
      Set.of(
          "169.254.169.254",
          "169.254.170.2",
          "100.100.100.200",
          "fd00:ec2::254",
          "metadata",
          "metadata.google.internal",
          "metadata.goog",
          "instance-data",
          "instance-data.ec2.internal");

  private final ResearchConfig researchConfig;
  private final HostResolver resolver;

  @Autowired
  public SsrfGuard(ResearchConfig researchConfig) {
    this(researchConfig, HostResolver.SYSTEM);
  }

  SsrfGuard(ResearchConfig researchConfig, HostResolver resolver) {
    this.researchConfig = researchConfig;
    this.resolver = resolver;
  }

  /**
   * Returns the parsed target when it is safe to fetch.
   *
   * @throws ScrapeException when the URL is malformed, unresolvable or points at a blocked address
   */
  public URI validate(String url) {
    if (url == null || url.isBlank()) {
      throw ScrapeException.blocked(String.valueOf(url), "empty URL");
    }
    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException e) {
      throw ScrapeException.blocked(url, "malformed URL");
    }

    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw ScrapeException.blocked(url, "unsupported scheme");
    }
    if (uri.getRawUserInfo() != null) {
      throw ScrapeException.blocked(url, "credentials in URL");
    }
    String host = normalizeHost(uri.getHost());
    if (host.isEmpty()) {
      throw ScrapeException.blocked(url, "missing host");
    }
    if (METADATA_HOSTS.contains(host)) {
      log.warn("Blocked scrape of metadata endpoint {}", host);
      throw ScrapeException.blocked(url, "metadata endpoint");
    }
    if (researchConfig.getScrape().isAllowPrivateNetwork()) {
      return uri;
    }
    if (host.equals("localhost")
        || host.endsWith(".localhost")
        || host.endsWith(".local")
        || host.endsWith(".internal")) {
      log.warn("Blocked scrape of internal host {}", host);
      throw ScrapeException.blocked(url, "internal host name");
    }

    InetAddress[] addresses;
    try {
      addresses = resolver.resolve(host);
    } catch (UnknownHostException e) {
      throw new ScrapeException(url, "Could not resolve host " + host, e);
    }
    if (addresses == null || addresses.length == 0) {
      throw new ScrapeException(url, "Could not resolve host " + host);
    }
    for (InetAddress address : addresses) {
      if (isBlockedAddress(address)) {
        log.warn("Blocked scrape of {}: {} resolves to {}", url, host, address.getHostAddress());
        throw ScrapeException.blocked(url, "private or reserved address");
      }
    }
    return uri;
  }

  static boolean isBlockedAddress(InetAddress address) {
    if (address.isAnyLocalAddress()
        || address.isLoopbackAddress()
        || address.isLinkLocalAddress()
        || address.isSiteLocalAddress()
        || address.isMulticastAddress()) {
      return true;
    }
    byte[] bytes = address.getAddress();
    if (address instanceof Inet4Address) {
      return isBlockedIpv4(bytes);
    }
    // fc00::/7 unique local
    if ((bytes[0] & 0xFE) == 0xFC) {
      return true;
    }
    byte[] embedded = embeddedIpv4(bytes);
    return embedded != null && isBlockedIpv4(embedded);
  }

  static boolean isBlockedIpv4(byte[] b) {
    int first = b[0] & 0xFF;
    int second = b[1] & 0xFF;
    return first == 0
        || first == 10
        || first == 127
        || (first == 169 && second == 254)
        || (first == 172 && second >= 16 && second <= 31)
        || (first == 192 && second == 168)
        || (first == 100 && second >= 64 && second <= 127)
        || (first == 198 && (second == 18 || second == 19))
        || first >= 224;
  }

  /** Extracts an IPv4 address carried inside an IPv6 address, or returns {@code null}. */
  static byte[] embeddedIpv4(byte[] b) {
    if (b.length != 16) {
      return null;
    }
    // ::ffff:a.b.c.d and ::a.b.c.d
    if (allZero(b, 0, 10)
        && ((b[10] == (byte) 0xFF && b[11] == (byte) 0xFF) || (b[10] == 0 && b[11] == 0))) {
      return Arrays.copyOfRange(b, 12, 16);
    }
    // 64:ff9b::/96 NAT64
    if (b[0] == 0
        && b[1] == 0x64
        && b[2] == (byte) 0xFF
        && b[3] == (byte) 0x9B
        && allZero(b, 4, 12)) {
      return Arrays.copyOfRange(b, 12, 16);
    }
    // 2002::/16 6to4
    if (b[0] == 0x20 && b[1] == 0x02) {
      return Arrays.copyOfRange(b, 2, 6);
    }
    // 2001:0::/32 Teredo, client address stored inverted
    if (b[0] == 0x20 && b[1] == 0x01 && b[2] == 0 && b[3] == 0) {
      byte[] client = Arrays.copyOfRange(b, 12, 16);
      for (int i = 0; i < client.length; i++) {
        client[i] = (byte) ~client[i];
      }
      return client;
    }
    return null;
  }

  private static boolean allZero(byte[] b, int from, int to) {
    for (int i = from; i < to; i++) {
      if (b[i] != 0) {
        return false;
      }
    }
    return true;
  }

  private static String normalizeHost(String host) {
    if (host == null) {
      return "";
    }
    String normalized = host.toLowerCase(Locale.ROOT);
    if (normalized.startsWith("[") && normalized.endsWith("]")) {
      normalized = normalized.substring(1, normalized.length() - 1);
    }
    while (normalized.endsWith(".")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized;
  }
}

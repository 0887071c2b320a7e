package com.flamingo.ai.researchchat.security;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the client address used as the rate limit key.
 *
 * <p>Only the socket address is read. Forwarding headers are honoured upstream by the container,
 * which rewrites the remote address when the connecting peer is a trusted proxy (see {@code
 * server.forward-headers-strategy} and {@code server.tomcat.remoteip.internal-proxies}). A client
 * talking to the server directly cannot pick its own key.
 */
public final class ClientIpResolver {

  static final String UNKNOWN = "unknown";

  private ClientIpResolver() {}

  public static String resolve(HttpServletRequest request) {
    String remote = request.getRemoteAddr();
    return remote == null || remote.isBlank() ? UNKNOWN : remote;
  }
}

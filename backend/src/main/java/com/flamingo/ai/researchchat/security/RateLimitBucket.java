package com.flamingo.ai.researchchat.security;

import java.time.Instant;

/**
 * Fixed-window request counter for one {@code route:client} key.
 *
 * @param key bucket key
 * @param windowStart start of the current window
 * @param count requests admitted in the current window
 */
public record RateLimitBucket(String key, Instant windowStart, int count) {

  Instant resetAt(long windowMs) {
    return windowStart.plusMillis(windowMs);
  }

  boolean isExpired(Instant now, long windowMs) {
    return !now.isBefore(resetAt(windowMs));
  }
}

package com.flamingo.ai.researchchat.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide keyed fixed-window limiter.
 *
 * <p>Buckets are replaced atomically per key and swept once their window has elapsed. Time comes
 * from the injected {@link Clock}.
 */
@Slf4j
public class RateLimiter {

  private final ConcurrentMap<String, RateLimitBucket> buckets = new ConcurrentHashMap<>();
  private final Clock clock;
  private final AtomicReference<Instant> lastSweep;

  public RateLimiter(Clock clock) {
    this.clock = clock;
    this.lastSweep = new AtomicReference<>(clock.instant());
  }

  /**
   * Records one request against {@code key} if the budget allows it.
   *
   * @param key bucket key, usually {@code route:client}
   * @param limit requests admitted per window
   * @param window window length
   * @return the decision, including a retry hint when rejected
   */
  public RateLimitDecision tryAcquire(String key, int limit, Duration window) {
    Instant now = clock.instant();
    long windowMs = window.toMillis();
    sweepIfDue(now, windowMs);

    AtomicBoolean allowed = new AtomicBoolean();
    RateLimitBucket bucket =
        buckets.compute(
            key,
            (k, current) -> {
              if (current == null || current.isExpired(now, windowMs)) {
                allowed.set(true);
                return new RateLimitBucket(k, now, 1);
              }
              if (current.count() < limit) {
                allowed.set(true);
                return new RateLimitBucket(k, current.windowStart(), current.count() + 1);
              }
              allowed.set(false);
              return current;
            });

    Instant resetAt = bucket.resetAt(windowMs);
    int remaining = Math.max(0, limit - bucket.count());
    if (allowed.get()) {
      return new RateLimitDecision(true, remaining, resetAt, 0);
    }
    long retryAfter = Math.max(1, (Duration.between(now, resetAt).toMillis() + 999) / 1000);
    log.debug("Rate limit hit for {} (retry in {}s)", key, retryAfter);
    return new RateLimitDecision(false, 0, resetAt, retryAfter);
  }

  /** Number of live buckets, for diagnostics. */
  public int size() {
    return buckets.size();
  }

  private void sweepIfDue(Instant now, long windowMs) {
    Instant previous = lastSweep.get();
    if (now.isBefore(previous.plusMillis(windowMs)) || !lastSweep.compareAndSet(previous, now)) {
      return;
    }
    buckets.values().removeIf(bucket -> bucket.isExpired(now, windowMs));
  }
}

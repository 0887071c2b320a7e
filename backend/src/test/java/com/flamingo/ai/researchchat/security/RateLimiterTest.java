package com.flamingo.ai.researchchat.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RateLimiter")
class RateLimiterTest {

  private static final Duration WINDOW = Duration.ofMinutes(1);

  private MutableClock clock;
  private RateLimiter rateLimiter;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-15T10:00:00Z"));
    rateLimiter = new RateLimiter(clock);
  }

  @Test
  @DisplayName("Should admit up to the limit and count down the remaining budget")
  void shouldAdmitUpToLimit() {
    assertThat(rateLimiter.tryAcquire("client:/api/search", 3, WINDOW).remaining()).isEqualTo(2);
    assertThat(rateLimiter.tryAcquire("client:/api/search", 3, WINDOW).remaining()).isEqualTo(1);
    RateLimitDecision last = rateLimiter.tryAcquire("client:/api/search", 3, WINDOW);

    assertThat(last.allowed()).isTrue();
    assertThat(last.remaining()).isZero();
  }

  @Test
  @DisplayName("Should reject the request after the limit with a retry hint")
  void shouldRejectOverLimit() {
    // given
    rateLimiter.tryAcquire("k", 2, WINDOW);
    rateLimiter.tryAcquire("k", 2, WINDOW);
    clock.advance(Duration.ofSeconds(20));

    // when
    RateLimitDecision decision = rateLimiter.tryAcquire("k", 2, WINDOW);

    // then
    assertThat(decision.allowed()).isFalse();
    assertThat(decision.retryAfterSeconds()).isEqualTo(40);
    assertThat(decision.resetAt()).isEqualTo(Instant.parse("2026-03-15T10:01:00Z"));
  }

  @Test
  @DisplayName("Should open a fresh window once the previous one has elapsed")
  void shouldResetAfterWindow() {
    // given
    rateLimiter.tryAcquire("k", 1, WINDOW);
    assertThat(rateLimiter.tryAcquire("k", 1, WINDOW).allowed()).isFalse();

    // when
    clock.advance(WINDOW);

    // then
    assertThat(rateLimiter.tryAcquire("k", 1, WINDOW).allowed()).isTrue();
  }

  @Test
  @DisplayName("Should keep separate budgets per key")
  void shouldIsolateKeys() {
    rateLimiter.tryAcquire("a", 1, WINDOW);

    assertThat(rateLimiter.tryAcquire("a", 1, WINDOW).allowed()).isFalse();
    assertThat(rateLimiter.tryAcquire("b", 1, WINDOW).allowed()).isTrue();
  }

  @Test
  @DisplayName("Should sweep expired buckets")
  void shouldSweepExpiredBuckets() {
    // given
    rateLimiter.tryAcquire("a", 5, WINDOW);
    rateLimiter.tryAcquire("b", 5, WINDOW);
    clock.advance(WINDOW.plusSeconds(1));

    // when
    rateLimiter.tryAcquire("c", 5, WINDOW);

    // then
    assertThat(rateLimiter.size()).isEqualTo(1);
  }

  private static final class MutableClock extends Clock {

    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}

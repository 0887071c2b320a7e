package com.flamingo.ai.researchchat.service.planner;

import com.flamingo.ai.researchchat.service.cache.ExpiringCache;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Process-wide cache of planning decisions keyed by fingerprint. */
@Component
@Slf4j
public class PlanCache {

  private static final long MAX_ENTRIES = 5_000;

  private final ExpiringCache<String, ResearchPlan> plans;
  private final Clock clock;

  public PlanCache(Ticker ticker, Clock clock) {
    this.plans = new ExpiringCache<>(MAX_ENTRIES, ticker);
    this.clock = clock;
  }

  public Optional<ResearchPlan> get(PlanFingerprint fingerprint) {
    return plans.get(fingerprint.value());
  }

  /** Stores {@code plan} under {@code fingerprint} and returns the stored copy. */
  public ResearchPlan put(PlanFingerprint fingerprint, ResearchPlan plan, Duration ttl) {
    ResearchPlan stored = plan.cached(fingerprint.value(), clock.instant());
    plans.put(fingerprint.value(), stored, ttl);
    return stored;
  }

  /** Drops every cached plan belonging to {@code conversationId}. */
  public int invalidateConversation(UUID conversationId) {
    String prefix = PlanFingerprint.prefix(conversationId);
    int removed = plans.invalidateIf(key -> key.startsWith(prefix));
    if (removed > 0) {
      log.debug("Invalidated {} cached plans for conversation {}", removed, conversationId);
    }
    return removed;
  }
}

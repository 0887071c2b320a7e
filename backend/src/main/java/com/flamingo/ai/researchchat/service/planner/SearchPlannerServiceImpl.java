package com.flamingo.ai.researchchat.service.planner;

import com.flamingo.ai.researchchat.agent.dto.SearchPlanResult;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import com.flamingo.ai.researchchat.security.RateLimiter;
import com.flamingo.ai.researchchat.service.context.ContextSummarizer;
import com.flamingo.ai.researchchat.service.context.TextNormalizer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Heuristic-first search planner with optional model assistance and fingerprint caching. */
@Service
@Slf4j
public class SearchPlannerServiceImpl implements SearchPlannerService {

  private static final int MODEL_SUMMARY_CHARS = 2000;
  private static final int MODEL_REASONS_CHARS = 500;

  private final ModelPlanClient modelPlanClient;
  private final ContextSummarizer contextSummarizer;
  private final PlanCache planCache;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final RateLimiter planRateLimiter;

  public SearchPlannerServiceImpl(
      ModelPlanClient modelPlanClient,
      ContextSummarizer contextSummarizer,
      PlanCache planCache,
      ResearchConfig researchConfig,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.modelPlanClient = modelPlanClient;
    this.contextSummarizer = contextSummarizer;
    this.planCache = planCache;
    this.researchConfig = researchConfig;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.planRateLimiter = new RateLimiter(clock);
  }

  @Override
  @Timed(value = "planner.plan", description = "Time to plan web research")
  public ResearchPlan plan(PlanningInput input) {
    try {
      return doPlan(input);
    } catch (RuntimeException e) {
      log.error(
          "Search planning failed for conversation {}: {}", input.conversationId(), e.getMessage());
      meterRegistry.counter("planner.errors").increment();
      return ResearchPlan.safeDefault("planner_error");
    }
  }

  private ResearchPlan doPlan(PlanningInput input) {
    String message = input.message() == null ? "" : input.message();
    if (message.trim().isEmpty()) {
      return ResearchPlan.empty();
    }

    ResearchConfig.Planner config = researchConfig.getPlanner();
    List<ConversationTurn> turns = input.recentTurns();
    PlanFingerprint fingerprint =
        PlanFingerprint.of(input.conversationId(), message, turns.size(), lastCreatedAt(turns));

    Optional<ResearchPlan> cached = planCache.get(fingerprint);
    if (cached.isPresent()) {
      meterRegistry.counter("planner.cache.hits").increment();
      log.debug("Plan cache hit for conversation {}", input.conversationId());
      return cached.get();
    }
    Duration ttl = Duration.ofMillis(config.getCacheTtlMs());

    boolean allowed =
        planRateLimiter
            .tryAcquire(
                input.conversationId().toString(),
                config.getRateLimitMaxRequests(),
                Duration.ofMillis(config.getRateLimitWindowMs()))
            .allowed();
    if (!allowed) {
      meterRegistry.counter("planner.rate_limited").increment();
      log.warn("Planning rate limit reached for conversation {}", input.conversationId());
      return planCache.put(fingerprint, ResearchPlan.rateLimited(message), ttl);
    }

    List<ConversationTurn> recent =
        turns.subList(Math.max(0, turns.size() - config.getRecentMessageWindow()), turns.size());
    String contextSummary = contextSummarizer.summarize(recent, input.rollingSummary());
    PlanningHeuristics.Signals signals =
        PlanningHeuristics.compute(message, recent, clock.instant());
    ResearchPlan defaultPlan = buildDefaultPlan(message, contextSummary, signals);

    if (!config.isLlmEnabled()) {
      return planCache.put(fingerprint, defaultPlan, ttl);
    }

    if (!PlanningHeuristics.shouldUseModel(signals.jaccard(), message)) {
      ResearchPlan enriched = enrichWithEntities(defaultPlan, contextSummary);
      return planCache.put(
          fingerprint, enriched, Duration.ofMillis(config.getHeuristicCacheTtlMs()));
    }

    ResearchPlan modelPlan =
        modelPlanClient.plan(contextSummary, message).map(r -> fromModel(r, message)).orElse(null);
    if (modelPlan == null) {
      return planCache.put(fingerprint, defaultPlan, ttl);
    }
    log.debug(
        "Model plan for conversation {}: shouldSearch={}, queries={}",
        input.conversationId(),
        modelPlan.shouldSearch(),
        modelPlan.queries().size());
    return planCache.put(fingerprint, modelPlan, ttl);
  }

  ResearchPlan buildDefaultPlan(
      String message, String contextSummary, PlanningHeuristics.Signals signals) {
    List<String> contextTokens =
        PlanningHeuristics.tokenSet(contextSummary).stream()
            .filter(token -> token.length() > 3)
            .limit(10)
            .toList();
    List<String> variants = new ArrayList<>();
    variants.add(message);
    if (contextTokens.size() >= 2) {
      variants.add(message + " " + contextTokens.get(0) + " " + contextTokens.get(1));
    }
    if (contextTokens.size() >= 4) {
      variants.add(message + " " + contextTokens.get(2) + " " + contextTokens.get(3));
    }
    Set<String> pool = new LinkedHashSet<>();
    for (String variant : variants) {
      String trimmed = variant.trim();
      if (!trimmed.isEmpty()) {
        pool.add(trimmed);
      }
    }
    List<String> queries = QueryDiversifier.diversify(new ArrayList<>(pool), message);

    boolean suggestNewChat = signals.suggestNewChat() || signals.jaccard() < 0.5;
    return new ResearchPlan(
        true,
        queries.isEmpty() ? List.of(message) : queries,
        signals.suggestNewChat() ? 0.85 : 0.65,
        contextSummary,
        null,
        null,
        suggestNewChat,
        String.format("jaccard=%.2f gapMin=%d", signals.jaccard(), signals.minutesGap()));
  }

  private ResearchPlan enrichWithEntities(ResearchPlan plan, String contextSummary) {
    List<String> entities = PlanningHeuristics.extractKeyEntities(contextSummary);
    if (entities.isEmpty() || plan.queries().isEmpty()) {
      return plan;
    }
    String base = plan.queries().get(0);
    List<String> extras = entities.subList(0, Math.min(2, entities.size()));
    String contextual = base + " " + String.join(" ", extras);
    return plan.withQueries(List.of(base, contextual));
  }

  private ResearchPlan fromModel(SearchPlanResult result, String message) {
    if (result == null || result.shouldSearch() == null || result.queries() == null) {
      return null;
    }
    Set<String> pool =
        new LinkedHashSet<>(
            result.queries().stream()
                .map(TextNormalizer::collapseWhitespace)
                .filter(query -> !query.isEmpty())
                .limit(researchConfig.getPlanner().getMaxQueries())
                .toList());
    List<String> queries = QueryDiversifier.diversify(new ArrayList<>(pool), message);
    return new ResearchPlan(
        result.shouldSearch(),
        queries.isEmpty() ? List.of(message) : queries,
        clampConfidence(result.decisionConfidence()),
        TextNormalizer.truncate(
            TextNormalizer.collapseWhitespace(result.contextSummary()), MODEL_SUMMARY_CHARS),
        null,
        null,
        Boolean.TRUE.equals(result.suggestNewChat()),
        TextNormalizer.truncate(
            TextNormalizer.collapseWhitespace(result.reasons()), MODEL_REASONS_CHARS));
  }

  static double clampConfidence(Double value) {
    if (value == null || value.isNaN() || value == 0.0) {
      return 0.5;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }

  private static Instant lastCreatedAt(List<ConversationTurn> turns) {
    Instant latest = null;
    for (ConversationTurn turn : turns) {
      if (turn.timestamp() != null && (latest == null || turn.timestamp().isAfter(latest))) {
        latest = turn.timestamp();
      }
    }
    return latest;
  }
}

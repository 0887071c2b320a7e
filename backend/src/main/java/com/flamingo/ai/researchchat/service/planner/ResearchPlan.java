package com.flamingo.ai.researchchat.service.planner;

import java.time.Instant;
import java.util.List;

/**
 * Decision on whether and how to search for a new message.
 *
 * @param shouldSearch whether web research should run
 * @param queries candidate search queries, most relevant first
 * @param confidence decision confidence in [0,1]
 * @param contextSummary digest of the conversation the decision was based on
 * @param fingerprint cache key of the decision, null until cached
 * @param cachedAt when the plan was cached, null until cached
 * @param suggestNewChat whether the message looks like a new topic
 * @param reasons short diagnostic explanation
 */
public record ResearchPlan(
    boolean shouldSearch,
    List<String> queries,
    double confidence,
    String contextSummary,
    String fingerprint,
    Instant cachedAt,
    boolean suggestNewChat,
    String reasons) {

  public ResearchPlan {
    queries = queries == null ? List.of() : List.copyOf(queries);
    contextSummary = contextSummary == null ? "" : contextSummary;
  }

  /** Plan for an empty message. */
  public static ResearchPlan empty() {
    return new ResearchPlan(false, List.of(), 0.9, "", null, null, false, "empty_input");
  }

  /** Plan used when the conversation exhausted its planning budget. */
  public static ResearchPlan rateLimited(String message) {
    return new ResearchPlan(true, List.of(message), 0.5, "", null, null, false, "rate_limited");
  }

  /** Plan returned when planning itself failed; generation continues without search. */
  public static ResearchPlan safeDefault(String reason) {
    return new ResearchPlan(false, List.of(), 0.0, "", null, null, false, reason);
  }

  public ResearchPlan cached(String fingerprint, Instant cachedAt) {
    return new ResearchPlan(
        shouldSearch,
        queries,
        confidence,
        contextSummary,
        fingerprint,
        cachedAt,
        suggestNewChat,
        reasons);
  }

  public ResearchPlan withQueries(List<String> newQueries) {
    return new ResearchPlan(
        shouldSearch,
        newQueries,
        confidence,
        contextSummary,
        fingerprint,
        cachedAt,
        suggestNewChat,
        reasons);
  }
}

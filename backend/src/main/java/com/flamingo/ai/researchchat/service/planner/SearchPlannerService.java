package com.flamingo.ai.researchchat.service.planner;

/** Decides whether a message needs web research and which queries to run. */
public interface SearchPlannerService {

  /**
   * Produces a research plan, reusing a cached decision for an identical fingerprint. Never throws;
   * failures yield a plan without search.
   */
  ResearchPlan plan(PlanningInput input);
}

package com.flamingo.ai.researchchat.service.planner;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Maximal-marginal-relevance selection over candidate queries. */
public final class QueryDiversifier {

  public static final int DEFAULT_MAX_QUERIES = 4;
  public static final double DEFAULT_LAMBDA = 0.7;

  private QueryDiversifier() {}

  public static List<String> diversify(List<String> pool, String reference) {
    return diversify(pool, reference, DEFAULT_MAX_QUERIES, DEFAULT_LAMBDA);
  }

  /**
   * Picks up to {@code maxQueries} candidates balancing relevance to {@code reference} against
   * novelty with respect to those already picked.
   */
  public static List<String> diversify(
      List<String> pool, String reference, int maxQueries, double lambda) {
    Set<String> referenceTokens = PlanningHeuristics.tokenSet(reference);
    List<String> selected = new ArrayList<>();
    Set<Integer> used = new HashSet<>();
    int target = Math.min(maxQueries, pool.size());

    while (selected.size() < target) {
      int bestIndex = -1;
      double bestScore = Double.NEGATIVE_INFINITY;
      for (int i = 0; i < pool.size(); i++) {
        if (used.contains(i)) {
          continue;
        }
        Set<String> candidate = PlanningHeuristics.tokenSet(pool.get(i));
        double relevance = PlanningHeuristics.jaccard(candidate, referenceTokens);
        double novelty = 1.0;
        for (String chosen : selected) {
          novelty =
              Math.min(
                  novelty,
                  1.0 - PlanningHeuristics.jaccard(candidate, PlanningHeuristics.tokenSet(chosen)));
        }
        double score = lambda * relevance + (1 - lambda) * novelty;
        if (score > bestScore) {
          bestScore = score;
          bestIndex = i;
        }
      }
      if (bestIndex < 0) {
        break;
      }
      used.add(bestIndex);
      selected.add(pool.get(bestIndex));
    }
    return selected;
  }
}

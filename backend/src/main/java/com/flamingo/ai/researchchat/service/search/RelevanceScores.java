package com.flamingo.ai.researchchat.service.search;

import com.fasterxml.jackson.databind.JsonNode;

/** Sanitizes relevance scores coming from untrusted payloads. */
public final class RelevanceScores {

  private RelevanceScores() {}

  /**
   * Clamps a numeric score to [0,1]. Returns {@code null} for {@code NaN} and for anything that
   * is not a number, so the field is dropped rather than coerced to zero.
   */
  public static Double sanitize(Object value) {
    if (!(value instanceof Number)) {
      return null;
    }
    double score = ((Number) value).doubleValue();
    if (Double.isNaN(score)) {
      return null;
    }
    return clamp(score);
  }

  public static Double sanitize(JsonNode node) {
    if (node == null || !node.isNumber()) {
      return null;
    }
    return sanitize(node.doubleValue());
  }

  public static double clamp(double score) {
    return Math.max(0.0, Math.min(1.0, score));
  }
}

package com.flamingo.ai.researchchat.service.generation;

import java.util.List;

/**
 * Result of streaming one answer.
 *
 * @param success whether an answer was produced in full
 * @param provider provider that produced (or was producing) the answer
 * @param failure why the answer is incomplete, {@code null} on success
 * @param attempts one line per provider that was tried and failed
 */
public record GenerationOutcome(
    boolean success, String provider, String failure, List<String> attempts) {

  public static final String SNIPPETS = "snippets";

  public GenerationOutcome {
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
  }

  static GenerationOutcome success(String provider, List<String> attempts) {
    return new GenerationOutcome(true, provider, null, attempts);
  }

  static GenerationOutcome interrupted(String provider, String failure, List<String> attempts) {
    return new GenerationOutcome(false, provider, failure, attempts);
  }
}

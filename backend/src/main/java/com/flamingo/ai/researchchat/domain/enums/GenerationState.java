package com.flamingo.ai.researchchat.domain.enums;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a generation session.
 *
 * <p>{@code PLANNING -> SEARCHING? -> SCRAPING? -> GENERATING -> DONE}, with {@code ERROR}
 * reachable from every non-terminal state.
 */
public enum GenerationState {
  PLANNING,
  SEARCHING,
  SCRAPING,
  GENERATING,
  DONE,
  ERROR;

  public boolean isTerminal() {
    return this == DONE || this == ERROR;
  }

  /** Returns whether a session in this state may move to {@code next}. */
  public boolean canTransitionTo(GenerationState next) {
    if (isTerminal()) {
      return false;
    }
    if (next == ERROR) {
      return true;
    }
    return allowedNext().contains(next);
  }

  /** Stage label used in progress frames. */
  public String stage() {
    return name().toLowerCase(Locale.ROOT);
  }

  private Set<GenerationState> allowedNext() {
    return switch (this) {
      case PLANNING -> EnumSet.of(SEARCHING, SCRAPING, GENERATING);
      case SEARCHING -> EnumSet.of(SCRAPING, GENERATING);
      case SCRAPING -> EnumSet.of(GENERATING);
      case GENERATING -> EnumSet.of(DONE);
      default -> EnumSet.noneOf(GenerationState.class);
    };
  }
}

package com.flamingo.ai.researchchat.domain.enums;

import java.util.Locale;

/** Defines the author of a conversation turn. */
public enum MessageRole {
  /** Turn written by the user. */
  USER,

  /** Turn produced by the research assistant. */
  ASSISTANT,

  /** System turn (instructions, notices). */
  SYSTEM;

  /** Lower-case label used in prompts and summaries. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}

package com.flamingo.ai.researchchat.service.context;

import java.util.regex.Pattern;

/** Small text helpers shared by the summarizer, planner and prompt builders. */
public final class TextNormalizer {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TextNormalizer() {}

  /** Collapses whitespace runs into single spaces and trims; null becomes empty. */
  public static String collapseWhitespace(String text) {
    if (text == null) {
      return "";
    }
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  /** Returns at most {@code maxChars} leading characters of {@code text}. */
  public static String truncate(String text, int maxChars) {
    if (text == null) {
      return "";
    }
    return text.length() <= maxChars ? text : text.substring(0, Math.max(0, maxChars));
  }
}

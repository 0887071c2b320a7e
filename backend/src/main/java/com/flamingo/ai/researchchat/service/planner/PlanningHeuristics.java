package com.flamingo.ai.researchchat.service.planner;

import com.flamingo.ai.researchchat.domain.enums.MessageRole;
import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import com.flamingo.ai.researchchat.service.context.TextNormalizer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Lexical signals used to decide whether a message needs model-assisted planning. */
public final class PlanningHeuristics {

  static final double MODEL_LOWER_JACCARD = 0.35;
  static final double MODEL_UPPER_JACCARD = 0.75;
  static final long NEW_CHAT_GAP_MINUTES = 120;

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
  private static final Pattern LEADING_PRONOUN =
      Pattern.compile("^(it|they|this|that|these|those)\\s");
  private static final Pattern COMPANIES =
      Pattern.compile(
          "\\b(Apple|Google|Microsoft|Amazon|Facebook|Meta|Tesla|OpenAI|Anthropic|IBM|Oracle"
              + "|Samsung|Sony|Netflix|Twitter|SpaceX)\\b",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern LOCATIONS =
      Pattern.compile(
          "\\b(Cupertino|California|Silicon Valley|Mountain View|Seattle|Austin|Texas|Ireland"
              + "|Singapore|Shanghai|China|United States|USA)\\b",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern TOPICS =
      Pattern.compile(
          "\\b(headquarters|HQ|office|campus|founded|CEO|founder|product|service|cloud|AI"
              + "|machine learning)\\b",
          Pattern.CASE_INSENSITIVE);

  private PlanningHeuristics() {}

  /**
   * Signals derived from the new message and the previous user turn.
   *
   * @param jaccard token overlap with the previous user turn
   * @param minutesGap minutes since the previous user turn
   * @param suggestNewChat whether the gap alone suggests a new conversation
   */
  public record Signals(double jaccard, long minutesGap, boolean suggestNewChat) {}

  public static List<String> tokenize(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    return Arrays.stream(NON_ALPHANUMERIC.split(text.toLowerCase(Locale.ROOT)))
        .filter(token -> !token.isEmpty())
        .toList();
  }

  public static Set<String> tokenSet(String text) {
    return new LinkedHashSet<>(tokenize(text));
  }

  public static double jaccard(Set<String> a, Set<String> b) {
    Set<String> union = new LinkedHashSet<>(a);
    union.addAll(b);
    if (union.isEmpty()) {
      return 0.0;
    }
    long intersection = a.stream().filter(b::contains).count();
    return (double) intersection / union.size();
  }

  /** Detects short follow-ups such as "what about X" or "and the price?". */
  public static boolean isFollowUp(String message) {
    String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
    return lower.contains("what about")
        || lower.contains("how about")
        || lower.startsWith("and ")
        || LEADING_PRONOUN.matcher(lower).find();
  }

  /** Model planning only pays off for ambiguous overlap or explicit follow-ups. */
  public static boolean shouldUseModel(double jaccard, String message) {
    return (jaccard >= MODEL_LOWER_JACCARD && jaccard <= MODEL_UPPER_JACCARD)
        || isFollowUp(message);
  }

  public static Signals compute(String message, List<ConversationTurn> recent, Instant now) {
    String current = TextNormalizer.collapseWhitespace(message);
    ConversationTurn previousUser = null;
    for (int i = recent.size() - 1; i >= 0; i--) {
      ConversationTurn turn = recent.get(i);
      if (turn.role() == MessageRole.USER
          && !TextNormalizer.collapseWhitespace(turn.text()).equals(current)) {
        previousUser = turn;
        break;
      }
    }
    if (previousUser == null) {
      for (int i = recent.size() - 1; i >= 0; i--) {
        if (recent.get(i).role() == MessageRole.USER) {
          previousUser = recent.get(i);
          break;
        }
      }
    }

    String previousText =
        previousUser != null ? TextNormalizer.collapseWhitespace(previousUser.text()) : "";
    double score = jaccard(tokenSet(previousText), tokenSet(current));
    long gap = 0;
    if (previousUser != null && previousUser.timestamp() != null) {
      gap = Math.max(0, Duration.between(previousUser.timestamp(), now).toMinutes());
    }
    return new Signals(score, gap, gap >= NEW_CHAT_GAP_MINUTES);
  }

  /** Pulls well-known entity names out of a context digest, at most five. */
  public static List<String> extractKeyEntities(String context) {
    if (context == null || context.isBlank()) {
      return List.of();
    }
    Set<String> entities = new LinkedHashSet<>();
    collect(COMPANIES, context, entities);
    collect(LOCATIONS, context, entities);
    List<String> topics = new ArrayList<>();
    Matcher matcher = TOPICS.matcher(context);
    while (matcher.find()) {
      topics.add(matcher.group().toLowerCase(Locale.ROOT));
    }
    if (topics.size() < 3) {
      entities.addAll(topics);
    }
    return entities.stream().limit(5).toList();
  }

  private static void collect(Pattern pattern, String context, Set<String> into) {
    Matcher matcher = pattern.matcher(context);
    while (matcher.find()) {
      into.add(matcher.group().toLowerCase(Locale.ROOT));
    }
  }
}

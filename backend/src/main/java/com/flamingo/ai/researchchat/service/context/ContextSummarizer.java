package com.flamingo.ai.researchchat.service.context;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.enums.MessageRole;
import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Compresses recent conversation history into a bounded digest.
 *
 * <p>The digest is assembled in priority order: the prior rolling summary, the last two user turns,
 * the last assistant turn, then compact one-liners for the remaining turns (oldest to newest) until
 * the character budget is used. The operation is pure and never fails.
 */
@Component
@RequiredArgsConstructor
public class ContextSummarizer {

  static final int PRIOR_SUMMARY_CHARS = 800;
  static final int RECENT_TURN_CHARS = 380;
  static final int ONE_LINER_CHARS = 220;
  static final int RECENT_USER_TURNS = 2;

  private final ResearchConfig researchConfig;

  /** Summarizes with the configured budget. */
  public String summarize(List<ConversationTurn> turns, String priorSummary) {
    return summarize(turns, priorSummary, researchConfig.getSummary().getMaxChars());
  }

  /**
   * Summarizes {@code turns} within {@code maxChars}.
   *
   * @param turns turns in chronological order
   * @param priorSummary previous rolling summary, may be null
   * @param maxChars character budget for the result
   * @return digest no longer than {@code maxChars}
   */
  public String summarize(List<ConversationTurn> turns, String priorSummary, int maxChars) {
    List<ConversationTurn> recent = lastTurns(turns, researchConfig.getSummary().getMaxTurns());

    List<String> lines = new ArrayList<>();
    String prior = TextNormalizer.collapseWhitespace(priorSummary);
    if (!prior.isEmpty()) {
      lines.add(TextNormalizer.truncate(prior, PRIOR_SUMMARY_CHARS));
    }

    for (ConversationTurn turn : lastUserTurns(recent)) {
      String text =
          TextNormalizer.truncate(
              TextNormalizer.collapseWhitespace(turn.text()), RECENT_TURN_CHARS);
      if (!text.isEmpty()) {
        lines.add("User: " + text);
      }
    }

    ConversationTurn lastAssistant = lastOfRole(recent, MessageRole.ASSISTANT);
    if (lastAssistant != null) {
      String text =
          TextNormalizer.truncate(
              TextNormalizer.collapseWhitespace(lastAssistant.text()), RECENT_TURN_CHARS);
      if (!text.isEmpty()) {
        lines.add("Assistant: " + text);
      }
    }

    Set<String> included = new HashSet<>(lines);
    for (ConversationTurn turn : recent) {
      String text = TextNormalizer.collapseWhitespace(turn.text());
      if (text.isEmpty()) {
        continue;
      }
      String line = prefix(turn.role()) + TextNormalizer.truncate(text, ONE_LINER_CHARS);
      if (!included.contains(line)) {
        lines.add(line);
      }
      if (String.join("\n", lines).length() >= maxChars) {
        break;
      }
    }
    return TextNormalizer.truncate(String.join("\n", lines), maxChars);
  }

  private static List<ConversationTurn> lastTurns(List<ConversationTurn> turns, int max) {
    if (turns == null || turns.isEmpty()) {
      return List.of();
    }
    return turns.subList(Math.max(0, turns.size() - max), turns.size());
  }

  private static List<ConversationTurn> lastUserTurns(List<ConversationTurn> recent) {
    List<ConversationTurn> users = new ArrayList<>();
    for (int i = recent.size() - 1; i >= 0 && users.size() < RECENT_USER_TURNS; i--) {
      if (recent.get(i).role() == MessageRole.USER) {
        users.add(0, recent.get(i));
      }
    }
    return users;
  }

  private static ConversationTurn lastOfRole(List<ConversationTurn> recent, MessageRole role) {
    for (int i = recent.size() - 1; i >= 0; i--) {
      if (recent.get(i).role() == role) {
        return recent.get(i);
      }
    }
    return null;
  }

  private static String prefix(MessageRole role) {
    return switch (role) {
      case USER -> "User: ";
      case ASSISTANT -> "Assistant: ";
      case SYSTEM -> "System: ";
    };
  }
}

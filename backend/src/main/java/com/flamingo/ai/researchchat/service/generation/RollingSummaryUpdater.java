package com.flamingo.ai.researchchat.service.generation;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import com.flamingo.ai.researchchat.service.collaborator.RollingSummaryStore;
import com.flamingo.ai.researchchat.service.context.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Folds a finished exchange into the conversation's rolling summary. */
@Component
@RequiredArgsConstructor
@Slf4j
public class RollingSummaryUpdater {

  static final int TURN_CHARS = 200;
  static final int REPLY_CHARS = 400;
  static final int RECENT_TURNS = 4;

  private final RollingSummaryStore rollingSummaryStore;
  private final ResearchConfig researchConfig;

  public void update(
      UUID conversationId,
      String priorSummary,
      List<ConversationTurn> history,
      String userMessage,
      String answer) {
    String summary =
        summarize(
            priorSummary,
            history,
            userMessage,
            answer,
            researchConfig.getGeneration().getRollingSummaryMaxChars());
    rollingSummaryStore.write(conversationId, summary);
    log.debug(
        "Rolling summary updated for conversation {} ({} chars)", conversationId, summary.length());
  }

  /** Builds the new summary; when over {@code maxChars} the oldest text is dropped. */
  static String summarize(
      String priorSummary,
      List<ConversationTurn> history,
      String userMessage,
      String answer,
      int maxChars) {
    List<String> lines = new ArrayList<>();
    String prior = TextNormalizer.collapseWhitespace(priorSummary);
    if (!prior.isEmpty()) {
      lines.add(TextNormalizer.truncate(prior, maxChars / 2));
    }
    List<ConversationTurn> recent =
        history.subList(Math.max(0, history.size() - RECENT_TURNS), history.size());
    for (ConversationTurn turn : recent) {
      lines.add(line(label(turn), turn.text(), TURN_CHARS));
    }
    lines.add(line("User", userMessage, TURN_CHARS));
    lines.add(line("Assistant", answer, REPLY_CHARS));

    String summary = String.join("\n", lines);
    return summary.length() <= maxChars ? summary : summary.substring(summary.length() - maxChars);
  }

  private static String line(String label, String text, int maxChars) {
    String clean = TextNormalizer.collapseWhitespace(text);
    return label + ": " + TextNormalizer.truncate(clean, maxChars);
  }

  private static String label(ConversationTurn turn) {
    return switch (turn.role()) {
      case USER -> "User";
      case ASSISTANT -> "Assistant";
      case SYSTEM -> "System";
    };
  }
}

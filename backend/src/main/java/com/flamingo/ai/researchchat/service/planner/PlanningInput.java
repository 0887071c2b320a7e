package com.flamingo.ai.researchchat.service.planner;

import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import java.util.List;
import java.util.UUID;

/**
 * Everything the planner looks at for one message.
 *
 * @param conversationId owning conversation
 * @param message the new user message
 * @param recentTurns stored turns in chronological order, excluding {@code message}
 * @param rollingSummary prior rolling summary, may be null
 */
public record PlanningInput(
    UUID conversationId,
    String message,
    List<ConversationTurn> recentTurns,
    String rollingSummary) {

  public PlanningInput {
    recentTurns = recentTurns == null ? List.of() : List.copyOf(recentTurns);
  }
}

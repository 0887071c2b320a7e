package com.flamingo.ai.researchchat.service.generation;

import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import java.util.List;

/**
 * Provider-neutral prompt for one answer.
 *
 * @param systemPrompt instructions with conversation and search context
 * @param history bounded recent turns in chronological order
 * @param userMessage the question being answered
 */
public record GenerationPrompt(
    String systemPrompt, List<ConversationTurn> history, String userMessage) {

  public GenerationPrompt {
    history = history == null ? List.of() : List.copyOf(history);
  }
}

package com.flamingo.ai.researchchat.domain.model;

import com.flamingo.ai.researchchat.domain.enums.MessageRole;
import java.time.Instant;

/**
 * Immutable view of a stored conversation turn.
 *
 * @param role author of the turn
 * @param text turn text
 * @param timestamp creation time, may be {@code null} for synthetic turns
 */
public record ConversationTurn(MessageRole role, String text, Instant timestamp) {

  public static ConversationTurn user(String text) {
    return new ConversationTurn(MessageRole.USER, text, null);
  }

  public static ConversationTurn assistant(String text) {
    return new ConversationTurn(MessageRole.ASSISTANT, text, null);
  }
}

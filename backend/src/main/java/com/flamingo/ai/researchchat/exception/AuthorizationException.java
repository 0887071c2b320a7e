package com.flamingo.ai.researchchat.exception;

import java.util.UUID;

/** Exception thrown when the caller may not write to a conversation. */
public class AuthorizationException extends RuntimeException {

  private final UUID conversationId;

  public AuthorizationException(UUID conversationId, String reason) {
    super("Write access denied for conversation " + conversationId + ": " + reason);
    this.conversationId = conversationId;
  }

  public UUID getConversationId() {
    return conversationId;
  }
}

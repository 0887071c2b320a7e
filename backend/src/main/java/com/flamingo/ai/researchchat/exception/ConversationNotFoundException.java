package com.flamingo.ai.researchchat.exception;

import java.util.UUID;

/** Exception thrown when a conversation or one of its messages does not exist. */
public class ConversationNotFoundException extends RuntimeException {

  public static final String CONVERSATION = "Conversation";
  public static final String MESSAGE = "Message";

  private final String kind;
  private final UUID id;

  public ConversationNotFoundException(UUID id) {
    this(CONVERSATION, id);
  }

  public ConversationNotFoundException(String kind, UUID id) {
    super(kind + " not found: " + id);
    this.kind = kind;
    this.id = id;
  }

  public String getKind() {
    return kind;
  }

  public UUID getId() {
    return id;
  }

  public boolean isMessage() {
    return MESSAGE.equals(kind);
  }
}

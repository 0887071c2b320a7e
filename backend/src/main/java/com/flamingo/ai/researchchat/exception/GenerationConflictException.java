package com.flamingo.ai.researchchat.exception;

import java.util.UUID;

/** Exception thrown when a second writer tries to drive an active generation session. */
public class GenerationConflictException extends RuntimeException {

  public GenerationConflictException(UUID assistantMessageId) {
    super("Generation already active for message " + assistantMessageId);
  }
}

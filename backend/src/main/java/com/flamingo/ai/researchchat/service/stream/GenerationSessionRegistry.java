package com.flamingo.ai.researchchat.service.stream;

import com.flamingo.ai.researchchat.exception.GenerationConflictException;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Active generation sessions keyed by assistant message id. */
@Component
public class GenerationSessionRegistry {

  private final Map<UUID, GenerationSession> active = new ConcurrentHashMap<>();

  /**
   * Registers a session.
   *
   * @throws GenerationConflictException when the assistant message already has an active writer
   */
  public void register(GenerationSession session) {
    GenerationSession existing = active.putIfAbsent(session.getAssistantMessageId(), session);
    if (existing != null) {
      throw new GenerationConflictException(session.getAssistantMessageId());
    }
  }

  public void release(GenerationSession session) {
    active.remove(session.getAssistantMessageId(), session);
  }

  public Optional<GenerationSession> find(UUID assistantMessageId) {
    return Optional.ofNullable(active.get(assistantMessageId));
  }

  public int activeCount() {
    return active.size();
  }
}

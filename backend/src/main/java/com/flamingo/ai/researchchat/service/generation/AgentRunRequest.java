package com.flamingo.ai.researchchat.service.generation;

import com.flamingo.ai.researchchat.domain.model.ContextReference;
import java.util.List;
import java.util.UUID;

/**
 * A validated request to answer one message.
 *
 * @param message sanitized user message
 * @param conversationId target conversation
 * @param sessionId client session, may be null
 * @param conversationContext client-supplied conversation digest, may be null
 * @param contextReferences client-supplied provenance records
 */
public record AgentRunRequest(
    String message,
    UUID conversationId,
    String sessionId,
    String conversationContext,
    List<ContextReference> contextReferences) {

  public AgentRunRequest {
    contextReferences = contextReferences == null ? List.of() : List.copyOf(contextReferences);
  }
}

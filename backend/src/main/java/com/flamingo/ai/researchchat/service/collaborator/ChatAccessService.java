package com.flamingo.ai.researchchat.service.collaborator;

import java.util.UUID;

/** Write-access checks for conversations. */
public interface ChatAccessService {

  /**
   * Verifies that {@code sessionId} may write to the conversation.
   *
   * @throws com.flamingo.ai.researchchat.exception.ConversationNotFoundException when the
   *     conversation does not exist
   * @throws com.flamingo.ai.researchchat.exception.AuthorizationException when the session is not
   *     the owner
   */
  void checkWriteAccess(UUID conversationId, String sessionId);
}

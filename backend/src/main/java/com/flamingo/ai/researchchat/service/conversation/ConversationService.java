package com.flamingo.ai.researchchat.service.conversation;

import com.flamingo.ai.researchchat.domain.entity.Conversation;
import java.util.UUID;

/** Service for managing conversations. */
public interface ConversationService {

  /**
   * Creates a conversation.
   *
   * @param title title, or null for the default
   * @param ownerSessionId session allowed to write to it, may be null
   */
  Conversation createConversation(String title, String ownerSessionId);

  Conversation getConversation(UUID conversationId);

  /** Deletes a conversation with its messages and drops its cached research plans. */
  void deleteConversation(UUID conversationId);

  /** Sets the title from the first message while the conversation still has the default title. */
  void updateTitleIfDefault(UUID conversationId, String firstMessage);
}

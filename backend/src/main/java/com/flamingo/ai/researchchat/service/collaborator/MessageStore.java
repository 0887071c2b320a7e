package com.flamingo.ai.researchchat.service.collaborator;

import com.flamingo.ai.researchchat.domain.entity.ChatMessage;
import com.flamingo.ai.researchchat.domain.enums.GenerationState;
import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Message storage used by the generation pipeline. */
public interface MessageStore {

  /** Returns up to {@code limit} of the latest finished turns in chronological order. */
  List<ConversationTurn> recentTurns(UUID conversationId, int limit);

  UUID appendUserMessage(UUID conversationId, String content);

  /** Creates the streaming assistant placeholder a generation run writes into. */
  UUID createAssistantMessage(UUID conversationId, String workflowId);

  void updateState(UUID messageId, GenerationState state);

  /**
   * Replaces the streamed content. Writes that would shorten the stored content are ignored so the
   * persisted answer only ever grows.
   */
  void updateContent(UUID messageId, String content);

  void updateReasoning(UUID messageId, String reasoning);

  void updateSearchResults(UUID messageId, List<SearchResult> results);

  /**
   * Writes the terminal state of an assistant message.
   *
   * @return {@code false} when the message was already finalized and nothing was written
   */
  boolean finalizeMessage(UUID messageId, MessageFinalization finalization);

  Optional<ChatMessage> findMessage(UUID messageId);
}

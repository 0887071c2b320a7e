package com.flamingo.ai.researchchat.service.collaborator;

import com.flamingo.ai.researchchat.domain.entity.Conversation;
import com.flamingo.ai.researchchat.domain.repository.ConversationRepository;
import com.flamingo.ai.researchchat.exception.AuthorizationException;
import com.flamingo.ai.researchchat.exception.ConversationNotFoundException;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Grants write access to the session that created a conversation. Conversations created without a
 * session are writable by anyone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationAccessService implements ChatAccessService {

  private final ConversationRepository conversationRepository;

  @Override
  @Transactional(readOnly = true)
  public void checkWriteAccess(UUID conversationId, String sessionId) {
    Conversation conversation =
        conversationRepository
            .findById(conversationId)
            .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    String owner = conversation.getOwnerSessionId();
    if (owner == null || owner.isBlank()) {
      return;
    }
    if (!owner.equals(sessionId)) {
      log.warn("Session mismatch on conversation {}", conversationId);
      throw new AuthorizationException(conversationId, "session does not own this conversation");
    }
  }
}

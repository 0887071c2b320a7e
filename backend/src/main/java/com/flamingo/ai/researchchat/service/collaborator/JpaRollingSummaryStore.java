package com.flamingo.ai.researchchat.service.collaborator;

import com.flamingo.ai.researchchat.domain.entity.Conversation;
import com.flamingo.ai.researchchat.domain.repository.ConversationRepository;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Keeps the rolling summary on the conversation row. */
@Service
@RequiredArgsConstructor
public class JpaRollingSummaryStore implements RollingSummaryStore {

  private final ConversationRepository conversationRepository;

  @Override
  @Transactional(readOnly = true)
  public Optional<String> read(UUID conversationId) {
    return conversationRepository
        .findById(conversationId)
        .map(Conversation::getRollingSummary)
        .filter(summary -> !summary.isBlank());
  }

  @Override
  @Transactional
  public void write(UUID conversationId, String summary) {
    conversationRepository
        .findById(conversationId)
        .ifPresent(
            conversation -> {
              conversation.setRollingSummary(summary);
              conversation.setRollingSummaryUpdatedAt(LocalDateTime.now());
            });
  }
}

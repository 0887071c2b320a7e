package com.flamingo.ai.researchchat.service.conversation;

import com.flamingo.ai.researchchat.domain.entity.Conversation;
import com.flamingo.ai.researchchat.domain.repository.ChatMessageRepository;
import com.flamingo.ai.researchchat.domain.repository.ConversationRepository;
import com.flamingo.ai.researchchat.exception.ConversationNotFoundException;
import com.flamingo.ai.researchchat.service.context.TextNormalizer;
import com.flamingo.ai.researchchat.service.planner.PlanCache;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of conversation management operations. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationServiceImpl implements ConversationService {

  static final int TITLE_CHARS = 25;
  private static final int MAX_TITLE_CHARS = 200;

  private final ConversationRepository conversationRepository;
  private final ChatMessageRepository chatMessageRepository;
  private final PlanCache planCache;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public Conversation createConversation(String title, String ownerSessionId) {
    String cleanTitle = TextNormalizer.collapseWhitespace(title);
    Conversation conversation =
        Conversation.builder()
            .title(
                cleanTitle.isEmpty()
                    ? Conversation.DEFAULT_TITLE
                    : TextNormalizer.truncate(cleanTitle, MAX_TITLE_CHARS))
            .ownerSessionId(ownerSessionId)
            .build();
    Conversation saved = conversationRepository.save(conversation);
    meterRegistry.counter("conversations.created").increment();
    log.info("Created conversation {}", saved.getId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Conversation getConversation(UUID conversationId) {
    return conversationRepository
        .findById(conversationId)
        .orElseThrow(() -> new ConversationNotFoundException(conversationId));
  }

  @Override
  @Transactional
  public void deleteConversation(UUID conversationId) {
    Conversation conversation = getConversation(conversationId);
    chatMessageRepository.deleteByConversationId(conversationId);
    conversationRepository.delete(conversation);
    int dropped = planCache.invalidateConversation(conversationId);
    meterRegistry.counter("conversations.deleted").increment();
    log.info("Deleted conversation {} ({} cached plans dropped)", conversationId, dropped);
  }

  @Override
  @Transactional
  public void updateTitleIfDefault(UUID conversationId, String firstMessage) {
    conversationRepository
        .findById(conversationId)
        .filter(Conversation::hasDefaultTitle)
        .ifPresent(
            conversation -> {
              String title = titleFrom(firstMessage);
              if (!title.isEmpty()) {
                conversation.setTitle(title);
                log.debug("Titled conversation {}", conversationId);
              }
            });
  }

  static String titleFrom(String message) {
    String text = TextNormalizer.collapseWhitespace(message);
    if (text.length() <= TITLE_CHARS) {
      return text;
    }
    return text.substring(0, TITLE_CHARS).trim() + "...";
  }
}

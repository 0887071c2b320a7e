package com.flamingo.ai.researchchat.service.collaborator;

import com.flamingo.ai.researchchat.domain.entity.ChatMessage;
import com.flamingo.ai.researchchat.domain.entity.Conversation;
import com.flamingo.ai.researchchat.domain.enums.GenerationState;
import com.flamingo.ai.researchchat.domain.enums.MessageRole;
import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.domain.repository.ChatMessageRepository;
import com.flamingo.ai.researchchat.domain.repository.ConversationRepository;
import com.flamingo.ai.researchchat.exception.ConversationNotFoundException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link MessageStore} backed by the JPA message table. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaMessageStore implements MessageStore {

  private final ChatMessageRepository chatMessageRepository;
  private final ConversationRepository conversationRepository;

  @Override
  @Transactional(readOnly = true)
  public List<ConversationTurn> recentTurns(UUID conversationId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    // Fetch a few extra rows so skipped placeholders do not shrink the window
    List<ChatMessage> newestFirst =
        chatMessageRepository.findRecentMessages(conversationId, PageRequest.of(0, limit + 4));
    List<ConversationTurn> turns = new ArrayList<>();
    for (ChatMessage message : newestFirst) {
      if (turns.size() == limit) {
        break;
      }
      if (isUsableTurn(message)) {
        turns.add(toTurn(message));
      }
    }
    Collections.reverse(turns);
    return turns;
  }

  @Override
  @Transactional
  public UUID appendUserMessage(UUID conversationId, String content) {
    ChatMessage message =
        ChatMessage.builder()
            .conversation(getConversation(conversationId))
            .role(MessageRole.USER)
            .content(content)
            .build();
    return chatMessageRepository.save(message).getId();
  }

  @Override
  @Transactional
  public UUID createAssistantMessage(UUID conversationId, String workflowId) {
    ChatMessage message =
        ChatMessage.builder()
            .conversation(getConversation(conversationId))
            .role(MessageRole.ASSISTANT)
            .generationState(GenerationState.PLANNING)
            .streaming(true)
            .workflowId(workflowId)
            .build();
    ChatMessage saved = chatMessageRepository.save(message);
    log.debug("Created assistant message {} for conversation {}", saved.getId(), conversationId);
    return saved.getId();
  }

  @Override
  @Transactional
  public void updateState(UUID messageId, GenerationState state) {
    findOpen(messageId).ifPresent(message -> message.setGenerationState(state));
  }

  @Override
  @Transactional
  public void updateContent(UUID messageId, String content) {
    findOpen(messageId)
        .ifPresent(
            message -> {
              String current = message.getContent() == null ? "" : message.getContent();
              if (content != null && content.length() >= current.length()) {
                message.setContent(content);
              }
            });
  }

  @Override
  @Transactional
  public void updateReasoning(UUID messageId, String reasoning) {
    findOpen(messageId).ifPresent(message -> message.setReasoning(reasoning));
  }

  @Override
  @Transactional
  public void updateSearchResults(UUID messageId, List<SearchResult> results) {
    findOpen(messageId)
        .ifPresent(message -> message.setSearchResults(new ArrayList<>(results)));
  }

  @Override
  @Transactional
  public boolean finalizeMessage(UUID messageId, MessageFinalization finalization) {
    ChatMessage message =
        chatMessageRepository
            .findById(messageId)
            .orElseThrow(
                () ->
                    new ConversationNotFoundException(
                        ConversationNotFoundException.MESSAGE, messageId));
    if (message.isFinalized()) {
      log.debug("Message {} already finalized as {}", messageId, message.getGenerationState());
      return false;
    }
    String current = message.getContent() == null ? "" : message.getContent();
    if (finalization.content().length() >= current.length()) {
      message.setContent(finalization.content());
    }
    if (finalization.reasoning() != null) {
      message.setReasoning(finalization.reasoning());
    }
    message.setGenerationState(finalization.state());
    message.setStreaming(false);
    message.setSources(new ArrayList<>(finalization.sources()));
    message.setContextReferences(new ArrayList<>(finalization.contextReferences()));
    message.setErrorDetails(new ArrayList<>(finalization.errorDetails()));
    return true;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<ChatMessage> findMessage(UUID messageId) {
    return chatMessageRepository.findById(messageId);
  }

  private Optional<ChatMessage> findOpen(UUID messageId) {
    Optional<ChatMessage> message = chatMessageRepository.findById(messageId);
    if (message.isEmpty()) {
      log.warn("Assistant message {} no longer exists, skipping update", messageId);
      return Optional.empty();
    }
    return message.filter(m -> !m.isFinalized());
  }

  private Conversation getConversation(UUID conversationId) {
    return conversationRepository
        .findById(conversationId)
        .orElseThrow(() -> new ConversationNotFoundException(conversationId));
  }

  private static boolean isUsableTurn(ChatMessage message) {
    if (message.getContent() == null || message.getContent().isBlank()) {
      return false;
    }
    return message.getRole() != MessageRole.ASSISTANT || message.isFinalized();
  }

  private static ConversationTurn toTurn(ChatMessage message) {
    return new ConversationTurn(
        message.getRole(),
        message.getContent(),
        message.getCreatedAt() != null
            ? message.getCreatedAt().atZone(ZoneId.systemDefault()).toInstant()
            : null);
  }
}

package com.flamingo.ai.researchchat.domain.repository;

import com.flamingo.ai.researchchat.domain.entity.ChatMessage;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ChatMessage entities. */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  /** Finds recent messages for a conversation, newest first. */
  @Query(
      "SELECT m FROM ChatMessage m WHERE m.conversation.id = :conversationId "
          + "ORDER BY m.createdAt DESC")
  List<ChatMessage> findRecentMessages(
      @Param("conversationId") UUID conversationId, Pageable pageable);

  /** Deletes all messages for a conversation. */
  void deleteByConversationId(UUID conversationId);
}

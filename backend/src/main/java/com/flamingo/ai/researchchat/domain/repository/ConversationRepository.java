package com.flamingo.ai.researchchat.domain.repository;

import com.flamingo.ai.researchchat.domain.entity.Conversation;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Conversation entities. */
@Repository
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {}

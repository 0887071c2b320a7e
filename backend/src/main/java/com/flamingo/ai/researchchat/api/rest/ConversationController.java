package com.flamingo.ai.researchchat.api.rest;

import com.flamingo.ai.researchchat.api.dto.request.CreateConversationRequest;
import com.flamingo.ai.researchchat.api.dto.response.ConversationResponse;
import com.flamingo.ai.researchchat.domain.entity.Conversation;
import com.flamingo.ai.researchchat.service.collaborator.ChatAccessService;
import com.flamingo.ai.researchchat.service.conversation.ConversationService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for conversation management. */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

  static final String SESSION_HEADER = "X-Session-Id";

  private final ConversationService conversationService;
  private final ChatAccessService chatAccessService;

  /** Creates a new conversation. */
  @PostMapping
  public ResponseEntity<ConversationResponse> createConversation(
      @Valid @RequestBody CreateConversationRequest request) {
    Conversation conversation =
        conversationService.createConversation(request.getTitle(), request.getSessionId());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ConversationResponse.fromEntity(conversation));
  }

  /** Gets a conversation by ID. */
  @GetMapping("/{conversationId}")
  public ResponseEntity<ConversationResponse> getConversation(@PathVariable UUID conversationId) {
    return ResponseEntity.ok(
        ConversationResponse.fromEntity(conversationService.getConversation(conversationId)));
  }

  /** Deletes a conversation; the caller's session must own it. */
  @DeleteMapping("/{conversationId}")
  public ResponseEntity<Void> deleteConversation(
      @PathVariable UUID conversationId,
      @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
    chatAccessService.checkWriteAccess(conversationId, sessionId);
    conversationService.deleteConversation(conversationId);
    return ResponseEntity.noContent().build();
  }
}

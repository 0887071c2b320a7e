package com.flamingo.ai.researchchat.api.dto.response;

import com.flamingo.ai.researchchat.domain.entity.Conversation;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for conversation data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationResponse {

  private UUID id;
  private String title;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a ConversationResponse from a Conversation entity. */
  public static ConversationResponse fromEntity(Conversation conversation) {
    return ConversationResponse.builder()
        .id(conversation.getId())
        .title(conversation.getTitle())
        .createdAt(conversation.getCreatedAt())
        .updatedAt(conversation.getUpdatedAt())
        .build();
  }
}

package com.flamingo.ai.researchchat.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a conversation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateConversationRequest {

  @Size(max = 200, message = "Title must not exceed 200 characters")
  private String title;

  /** Session that may write to the conversation; omitted for an open conversation. */
  @Size(max = 200, message = "Session ID must not exceed 200 characters")
  private String sessionId;
}

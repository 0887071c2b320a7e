package com.flamingo.ai.researchchat.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting an agent run.
 *
 * <p>Length limits on the message apply after control characters are stripped, so they are checked
 * by {@link com.flamingo.ai.researchchat.api.validation.AgentRequestSanitizer}, which also trims
 * the optional context fields to their caps.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStreamRequest {

  @NotBlank(message = "Message is required")
  private String message;

  @NotNull(message = "Conversation ID is required")
  private UUID conversationId;

  @Size(max = 200, message = "Session ID must not exceed 200 characters")
  private String sessionId;

  private String conversationContext;

  @Valid private List<ContextReferenceRequest> contextReferences;
}

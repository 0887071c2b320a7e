package com.flamingo.ai.researchchat.api.dto.response;

import com.flamingo.ai.researchchat.domain.entity.ChatMessage;
import com.flamingo.ai.researchchat.domain.enums.GenerationState;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Latest persisted state of a generation run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSessionResponse {

  private UUID assistantMessageId;
  private String workflowId;
  private GenerationState state;
  private boolean streaming;

  /** Whether a writer is still attached in this process. */
  private boolean active;

  private String content;
  private String reasoning;
  private List<String> sources;
  private List<SearchResult> searchResults;
  private List<ContextReference> contextReferences;
  private List<String> errorDetails;
  private LocalDateTime updatedAt;

  /** Creates an AgentSessionResponse from an assistant message. */
  public static AgentSessionResponse fromEntity(ChatMessage message, boolean active) {
    return AgentSessionResponse.builder()
        .assistantMessageId(message.getId())
        .workflowId(message.getWorkflowId())
        .state(message.getGenerationState())
        .streaming(Boolean.TRUE.equals(message.getStreaming()))
        .active(active)
        .content(message.getContent())
        .reasoning(message.getReasoning())
        .sources(message.getSources())
        .searchResults(message.getSearchResults())
        .contextReferences(message.getContextReferences())
        .errorDetails(message.getErrorDetails())
        .updatedAt(message.getUpdatedAt())
        .build();
  }
}

package com.flamingo.ai.researchchat.api.dto.response;

import com.flamingo.ai.researchchat.domain.entity.WorkflowToken;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Acknowledgement of a verified persisted notification. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersistedAckResponse {

  private boolean verified;
  private String workflowId;
  private UUID conversationId;

  public static PersistedAckResponse fromEntity(WorkflowToken token) {
    return new PersistedAckResponse(true, token.getWorkflowId(), token.getConversationId());
  }
}

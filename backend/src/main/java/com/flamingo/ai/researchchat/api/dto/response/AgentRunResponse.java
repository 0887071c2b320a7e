package com.flamingo.ai.researchchat.api.dto.response;

import com.flamingo.ai.researchchat.service.generation.AgentRun;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a run accepted in the background. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunResponse {

  private UUID assistantMessageId;
  private String workflowId;

  public static AgentRunResponse from(AgentRun run) {
    return new AgentRunResponse(run.assistantMessageId(), run.workflowId());
  }
}

package com.flamingo.ai.researchchat.service.generation;

import com.flamingo.ai.researchchat.api.dto.response.AgentSessionResponse;
import java.util.UUID;

/** Service for starting research-augmented answer runs. */
public interface AgentRunService {

  /**
   * Starts a run whose frames are streamed to the caller.
   *
   * @throws com.flamingo.ai.researchchat.exception.ConversationNotFoundException when the
   *     conversation does not exist
   * @throws com.flamingo.ai.researchchat.exception.AuthorizationException when the session may not
   *     write to it
   */
  AgentRun startStreaming(AgentRunRequest request);

  /** Starts a run in the background; progress is observable through {@link #getSessionState}. */
  AgentRun startBackground(AgentRunRequest request);

  /**
   * Returns the latest persisted state of a run.
   *
   * @throws com.flamingo.ai.researchchat.exception.AuthorizationException when {@code sessionId}
   *     may not access the run's conversation
   */
  AgentSessionResponse getSessionState(UUID assistantMessageId, String sessionId);
}

package com.flamingo.ai.researchchat.service.generation;

import com.flamingo.ai.researchchat.api.dto.response.AgentSessionResponse;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.entity.ChatMessage;
import com.flamingo.ai.researchchat.domain.entity.WorkflowToken;
import com.flamingo.ai.researchchat.domain.enums.MessageRole;
import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import com.flamingo.ai.researchchat.exception.ConversationNotFoundException;
import com.flamingo.ai.researchchat.service.collaborator.BackgroundTaskScheduler;
import com.flamingo.ai.researchchat.service.collaborator.ChatAccessService;
import com.flamingo.ai.researchchat.service.collaborator.MessageStore;
import com.flamingo.ai.researchchat.service.stream.EventPersistenceBridge;
import com.flamingo.ai.researchchat.service.stream.FrameChannel;
import com.flamingo.ai.researchchat.service.stream.GenerationSession;
import com.flamingo.ai.researchchat.service.stream.GenerationSessionRegistry;
import com.flamingo.ai.researchchat.service.stream.WorkflowTokenService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Prepares a run on the request thread (access check, user message, assistant placeholder,
 * workflow token) and hands the pipeline to the background scheduler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunServiceImpl implements AgentRunService {

  static final String BUSY = "The service is busy. Please try again in a moment.";

  private final ChatAccessService chatAccessService;
  private final MessageStore messageStore;
  private final WorkflowTokenService workflowTokenService;
  private final GenerationSessionRegistry sessionRegistry;
  private final EventPersistenceBridge bridge;
  private final BackgroundTaskScheduler backgroundTaskScheduler;
  private final ResearchPipeline researchPipeline;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public AgentRun startStreaming(AgentRunRequest request) {
    return start(request, true);
  }

  @Override
  public AgentRun startBackground(AgentRunRequest request) {
    return start(request, false);
  }

  @Override
  public AgentSessionResponse getSessionState(UUID assistantMessageId, String sessionId) {
    ChatMessage message =
        messageStore
            .findMessage(assistantMessageId)
            .filter(m -> m.getRole() == MessageRole.ASSISTANT)
            .orElseThrow(
                () ->
                    new ConversationNotFoundException(
                        ConversationNotFoundException.MESSAGE, assistantMessageId));
    chatAccessService.checkWriteAccess(message.getConversation().getId(), sessionId);
    boolean active = sessionRegistry.find(assistantMessageId).isPresent();
    return AgentSessionResponse.fromEntity(message, active);
  }

  private AgentRun start(AgentRunRequest request, boolean attached) {
    chatAccessService.checkWriteAccess(request.conversationId(), request.sessionId());

    int window =
        Math.max(
            researchConfig.getPlanner().getRecentMessageWindow(),
            researchConfig.getGeneration().getMaxHistoryMessages());
    List<ConversationTurn> history = messageStore.recentTurns(request.conversationId(), window);
    messageStore.appendUserMessage(request.conversationId(), request.message());
    WorkflowToken token = workflowTokenService.issue(request.conversationId(), request.sessionId());
    UUID assistantMessageId =
        messageStore.createAssistantMessage(request.conversationId(), token.getWorkflowId());

    GenerationSession session =
        new GenerationSession(
            request.conversationId(),
            assistantMessageId,
            token.getWorkflowId(),
            token.getNonce(),
            request.message());
    sessionRegistry.register(session);
    FrameChannel channel = bridge.openChannel(attached);
    meterRegistry
        .counter("agent.runs.started", "mode", attached ? "stream" : "background")
        .increment();
    log.info(
        "Starting agent run {} for conversation {} (workflow {})",
        assistantMessageId,
        request.conversationId(),
        token.getWorkflowId());

    try {
      backgroundTaskScheduler.schedule(
          "agent-run-" + assistantMessageId,
          () -> researchPipeline.run(session, channel, request, history));
    } catch (RejectedExecutionException e) {
      bridge.fail(session, channel, BUSY);
      sessionRegistry.release(session);
    }
    return new AgentRun(assistantMessageId, token.getWorkflowId(), channel.frames());
  }
}

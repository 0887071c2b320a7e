package com.flamingo.ai.researchchat.service.stream;

import com.flamingo.ai.researchchat.api.dto.response.PersistedPayload;
import com.flamingo.ai.researchchat.api.dto.response.StreamFrame;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.enums.GenerationState;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.service.collaborator.MessageFinalization;
import com.flamingo.ai.researchchat.service.collaborator.MessageStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns session progress into ordered stream frames and mirrors it into the assistant message.
 *
 * <p>Every state change is persisted before its frame is emitted, so a client that reconnects sees
 * at least what was streamed. Exactly one of {@link #complete} and {@link #fail} takes effect per
 * session; the loser is a no-op.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventPersistenceBridge {

  static final String APOLOGY =
      "Sorry, the response was interrupted before it finished. The partial answer has been kept.";

  private final MessageStore messageStore;
  private final WorkflowTokenService workflowTokenService;
  private final PayloadSigner payloadSigner;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  /** Opens the frame channel for a session; a detached channel has no reader. */
  public FrameChannel openChannel(boolean attached) {
    if (!attached) {
      return FrameChannel.detached();
    }
    ResearchConfig.Stream stream = researchConfig.getStream();
    return FrameChannel.bounded(
        stream.getFrameBufferSize(), Duration.ofMillis(stream.getStallTimeoutMs()));
  }

  /** Announces the initial planning stage the session was created in. */
  public void begin(GenerationSession session, FrameChannel channel, String message) {
    messageStore.updateState(session.getAssistantMessageId(), session.getState());
    channel.emit(StreamFrame.progress(session.getState().stage(), message));
  }

  /**
   * Moves the session into a working stage, persists it and announces it.
   *
   * @return {@code false} when the session cannot enter {@code stage}
   */
  public boolean enterStage(
      GenerationSession session, FrameChannel channel, GenerationState stage, String message) {
    if (!session.transitionTo(stage)) {
      log.debug(
          "Session {} cannot move from {} to {}", session.getId(), session.getState(), stage);
      return false;
    }
    messageStore.updateState(session.getAssistantMessageId(), stage);
    channel.emit(StreamFrame.progress(stage.stage(), message));
    return true;
  }

  public void toolResult(FrameChannel channel, String toolName, Object result, long durationMs) {
    channel.emit(StreamFrame.toolResult(toolName, result, durationMs));
  }

  /** Records the sources an answer is built from and announces them. */
  public void sources(
      GenerationSession session,
      FrameChannel channel,
      List<SearchResult> results,
      List<ContextReference> contextReferences,
      double confidence,
      boolean complete) {
    session.setSources(results);
    session.setContextReferences(contextReferences);
    messageStore.updateSearchResults(session.getAssistantMessageId(), results);
    channel.emit(
        StreamFrame.metadata(
            results, contextReferences, confidence, complete ? "complete" : "partial"));
  }

  public void contentDelta(FrameChannel channel, String delta) {
    channel.emit(StreamFrame.contentDelta(delta));
  }

  /** Announces an answer that was produced in one piece rather than streamed. */
  public void contentWhole(FrameChannel channel, String content) {
    channel.emit(StreamFrame.content(content));
  }

  public void reasoningDelta(FrameChannel channel, String delta) {
    channel.emit(StreamFrame.reasoning(delta));
  }

  public void persistContent(GenerationSession session, String content) {
    messageStore.updateContent(session.getAssistantMessageId(), content);
  }

  public void persistReasoning(GenerationSession session, String reasoning) {
    messageStore.updateReasoning(session.getAssistantMessageId(), reasoning);
  }

  /**
   * Finalizes a successful session: persists the answer, completes the workflow token and emits
   * {@code complete}, followed by a signed {@code persisted} frame when signing is configured and
   * the token could be completed.
   *
   * @return whether this call finalized the session
   */
  public boolean complete(GenerationSession session, FrameChannel channel, String provider) {
    if (!session.transitionTo(GenerationState.DONE)) {
      log.debug("Session {} already finished as {}", session.getId(), session.getState());
      return false;
    }
    String content = session.getContent();
    List<String> sourceUrls = session.getSources().stream().map(SearchResult::url).toList();
    try {
      boolean written =
          messageStore.finalizeMessage(
              session.getAssistantMessageId(),
              new MessageFinalization(
                  GenerationState.DONE,
                  content,
                  session.getReasoning(),
                  sourceUrls,
                  session.getContextReferences(),
                  List.of()));
      if (!written) {
        log.warn("Assistant message {} was already final", session.getAssistantMessageId());
      }
    } catch (RuntimeException e) {
      String errorId = UUID.randomUUID().toString();
      log.error(
          "Failed to persist answer for message {} [errorId={}]",
          session.getAssistantMessageId(),
          errorId,
          e);
      meterRegistry.counter("generation.persist.errors").increment();
      workflowTokenService.invalidate(session.getWorkflowId());
      emitTerminal(
          session, channel, List.of(StreamFrame.error(errorId, "Failed to save the response.")));
      return true;
    }

    List<StreamFrame> frames = new ArrayList<>();
    frames.add(
        StreamFrame.complete(
            session.getAssistantMessageId().toString(),
            session.getWorkflowId(),
            provider,
            content.length()));
    PersistedPayload payload = null;
    String signature = null;
    if (payloadSigner.isEnabled()) {
      payload =
          PersistedPayload.builder()
              .assistantMessageId(session.getAssistantMessageId().toString())
              .workflowId(session.getWorkflowId())
              .conversationId(session.getConversationId().toString())
              .answer(content)
              .sources(sourceUrls)
              .contextReferences(session.getContextReferences())
              .build();
      signature = payloadSigner.sign(payload, session.getNonce());
    }
    boolean tokenCompleted =
        workflowTokenService.complete(
            session.getWorkflowId(), session.getConversationId(), signature);
    if (payload != null && tokenCompleted) {
      frames.add(StreamFrame.persisted(payload, session.getNonce(), signature));
    }
    emitTerminal(session, channel, frames);
    meterRegistry.counter("generation.completed", "provider", provider).increment();
    log.info(
        "Generation completed for message {} via {} ({} chars)",
        session.getAssistantMessageId(),
        provider,
        content.length());
    return true;
  }

  /**
   * Finalizes a failed session. Content streamed so far is kept and the apology is appended to it;
   * the error frame then carries the apology instead of the raw reason.
   *
   * @return whether this call finalized the session
   */
  public boolean fail(GenerationSession session, FrameChannel channel, String reason) {
    if (!session.transitionTo(GenerationState.ERROR)) {
      log.debug("Session {} already finished as {}", session.getId(), session.getState());
      return false;
    }
    String errorId = UUID.randomUUID().toString();
    session.addError(reason);
    boolean partial = session.hasContent();
    String content = partial ? session.getContent() + "\n\n" + APOLOGY : session.getContent();
    List<String> sourceUrls = session.getSources().stream().map(SearchResult::url).toList();
    try {
      messageStore.finalizeMessage(
          session.getAssistantMessageId(),
          new MessageFinalization(
              GenerationState.ERROR,
              content,
              session.getReasoning(),
              sourceUrls,
              session.getContextReferences(),
              session.getErrorDetails()));
    } catch (RuntimeException e) {
      log.error(
          "Failed to persist error state for message {} [errorId={}]",
          session.getAssistantMessageId(),
          errorId,
          e);
    }
    workflowTokenService.invalidate(session.getWorkflowId());
    emitTerminal(session, channel, List.of(StreamFrame.error(errorId, partial ? APOLOGY : reason)));
    meterRegistry.counter("generation.failed", "partial", String.valueOf(partial)).increment();
    log.warn(
        "Generation failed for message {} [errorId={}, partial={}]: {}",
        session.getAssistantMessageId(),
        errorId,
        partial,
        reason);
    return true;
  }

  private void emitTerminal(
      GenerationSession session, FrameChannel channel, List<StreamFrame> frames) {
    if (!channel.emitTerminal(frames)) {
      meterRegistry.counter("stream.terminal.undelivered").increment();
      log.warn(
          "Terminal frame for message {} did not reach the stream; persisted state is final",
          session.getAssistantMessageId());
    }
  }
}

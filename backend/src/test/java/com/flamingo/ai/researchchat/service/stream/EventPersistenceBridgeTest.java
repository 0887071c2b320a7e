package com.flamingo.ai.researchchat.service.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchchat.api.dto.response.StreamFrame;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.enums.GenerationState;
import com.flamingo.ai.researchchat.service.collaborator.MessageFinalization;
import com.flamingo.ai.researchchat.service.collaborator.MessageStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventPersistenceBridge")
class EventPersistenceBridgeTest {

  @Mock private MessageStore messageStore;
  @Mock private WorkflowTokenService workflowTokenService;

  private ResearchConfig researchConfig;
  private SimpleMeterRegistry meterRegistry;
  private EventPersistenceBridge bridge;
  private GenerationSession session;

  @BeforeEach
  void setUp() {
    researchConfig = new ResearchConfig();
    meterRegistry = new SimpleMeterRegistry();
    PayloadSigner signer = new PayloadSigner(researchConfig, new ObjectMapper());
    bridge =
        new EventPersistenceBridge(
            messageStore, workflowTokenService, signer, researchConfig, meterRegistry);
    session =
        new GenerationSession(
            UUID.randomUUID(), UUID.randomUUID(), "wf-1", "nonce-1", "What is new?");
  }

  private static List<StreamFrame> drain(FrameChannel channel) {
    return channel.frames().collectList().block();
  }

  @Test
  @DisplayName("Should emit exactly one terminal frame when completion follows failure")
  void shouldEmitSingleTerminalFrame() {
    // given
    FrameChannel channel = bridge.openChannel(true);
    bridge.enterStage(session, channel, GenerationState.GENERATING, "Writing");

    // when
    boolean failed = bridge.fail(session, channel, "primary: boom");
    boolean completed = bridge.complete(session, channel, "primary");

    // then
    assertThat(failed).isTrue();
    assertThat(completed).isFalse();
    List<StreamFrame> frames = drain(channel);
    assertThat(frames.stream().filter(StreamFrame::isTerminal)).hasSize(1);
    assertThat(frames.get(frames.size() - 1).getType()).isEqualTo(StreamFrame.ERROR);
    verify(workflowTokenService).invalidate("wf-1");
    verify(workflowTokenService, never()).complete(any(), any(), any());
  }

  @Test
  @DisplayName("Should keep partial content and append an apology when failing mid-answer")
  void shouldKeepPartialContentOnFailure() {
    // given
    FrameChannel channel = bridge.openChannel(true);
    bridge.enterStage(session, channel, GenerationState.GENERATING, "Writing");
    session.appendContent("Hello");

    // when
    bridge.fail(session, channel, "primary: connection reset");

    // then
    ArgumentCaptor<MessageFinalization> captor =
        ArgumentCaptor.forClass(MessageFinalization.class);
    verify(messageStore).finalizeMessage(eq(session.getAssistantMessageId()), captor.capture());
    assertThat(captor.getValue().state()).isEqualTo(GenerationState.ERROR);
    assertThat(captor.getValue().content())
        .startsWith("Hello")
        .isEqualTo("Hello\n\n" + EventPersistenceBridge.APOLOGY);
    assertThat(captor.getValue().errorDetails()).containsExactly("primary: connection reset");

    StreamFrame last = drain(channel).get(1);
    assertThat(((StreamFrame.ErrorData) last.getData()).getError())
        .isEqualTo(EventPersistenceBridge.APOLOGY);
  }

  @Test
  @DisplayName("Should leave empty content alone when failing before the first token")
  void shouldNotApologizeWithoutContent() {
    // given
    FrameChannel channel = bridge.openChannel(true);
    bridge.enterStage(session, channel, GenerationState.GENERATING, "Writing");

    // when
    bridge.fail(session, channel, "All generation providers failed");

    // then
    ArgumentCaptor<MessageFinalization> captor =
        ArgumentCaptor.forClass(MessageFinalization.class);
    verify(messageStore).finalizeMessage(eq(session.getAssistantMessageId()), captor.capture());
    assertThat(captor.getValue().content()).isEmpty();
    StreamFrame last = drain(channel).get(1);
    assertThat(((StreamFrame.ErrorData) last.getData()).getError())
        .isEqualTo("All generation providers failed");
  }

  @Test
  @DisplayName("Should still finalize the answer when the stream reader has gone away")
  void shouldFinalizeWhenReaderCancelled() {
    // given
    FrameChannel channel = bridge.openChannel(true);
    channel.frames().subscribe().dispose();
    bridge.enterStage(session, channel, GenerationState.GENERATING, "Writing");
    session.appendContent("Answer nobody is watching");
    when(messageStore.finalizeMessage(any(), any())).thenReturn(true);

    // when
    boolean completed = bridge.complete(session, channel, "primary");

    // then
    assertThat(completed).isTrue();
    assertThat(channel.isFailed()).isTrue();
    verify(workflowTokenService)
        .complete(eq("wf-1"), eq(session.getConversationId()), isNull());
    assertThat(meterRegistry.counter("stream.terminal.undelivered").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should finalize, complete the token and emit complete without signing")
  void shouldCompleteWithoutSigning() {
    // given
    FrameChannel channel = bridge.openChannel(true);
    bridge.enterStage(session, channel, GenerationState.GENERATING, "Writing");
    session.appendContent("Hello world");
    when(messageStore.finalizeMessage(eq(session.getAssistantMessageId()), any()))
        .thenReturn(true);

    // when
    boolean completed = bridge.complete(session, channel, "primary");

    // then
    assertThat(completed).isTrue();
    assertThat(session.getState()).isEqualTo(GenerationState.DONE);
    verify(workflowTokenService)
        .complete(eq("wf-1"), eq(session.getConversationId()), isNull());
    List<StreamFrame> frames = drain(channel);
    assertThat(frames).extracting(StreamFrame::getType)
        .containsExactly(StreamFrame.PROGRESS, StreamFrame.COMPLETE);
    StreamFrame.CompleteData data = (StreamFrame.CompleteData) frames.get(1).getData();
    assertThat(data.getContentLength()).isEqualTo(11);
    assertThat(data.getWorkflowId()).isEqualTo("wf-1");
  }

  @Test
  @DisplayName("Should follow complete with a signed persisted frame when signing is on")
  void shouldEmitPersistedFrame() {
    // given
    researchConfig.getSigning().setSecret("secret");
    FrameChannel channel = bridge.openChannel(true);
    bridge.enterStage(session, channel, GenerationState.GENERATING, "Writing");
    session.appendContent("Signed answer");
    when(messageStore.finalizeMessage(any(), any())).thenReturn(true);
    when(workflowTokenService.complete(any(), any(), any())).thenReturn(true);

    // when
    bridge.complete(session, channel, "secondary");

    // then
    List<StreamFrame> frames = drain(channel);
    assertThat(frames).extracting(StreamFrame::getType)
        .containsExactly(StreamFrame.PROGRESS, StreamFrame.COMPLETE, StreamFrame.PERSISTED);
    StreamFrame.PersistedData persisted = (StreamFrame.PersistedData) frames.get(2).getData();
    assertThat(persisted.getNonce()).isEqualTo("nonce-1");
    assertThat(persisted.getPayload().getAnswer()).isEqualTo("Signed answer");
    assertThat(persisted.getPayload().getConversationId())
        .isEqualTo(session.getConversationId().toString());
    verify(workflowTokenService)
        .complete("wf-1", session.getConversationId(), persisted.getSignature());
  }

  @Test
  @DisplayName("Should withhold the persisted frame when the workflow token cannot be completed")
  void shouldWithholdPersistedFrameForExpiredToken() {
    // given
    researchConfig.getSigning().setSecret("secret");
    FrameChannel channel = bridge.openChannel(true);
    bridge.enterStage(session, channel, GenerationState.GENERATING, "Writing");
    session.appendContent("Late answer");
    when(messageStore.finalizeMessage(any(), any())).thenReturn(true);
    when(workflowTokenService.complete(any(), any(), any())).thenReturn(false);

    // when
    boolean completed = bridge.complete(session, channel, "primary");

    // then
    assertThat(completed).isTrue();
    assertThat(drain(channel)).extracting(StreamFrame::getType)
        .containsExactly(StreamFrame.PROGRESS, StreamFrame.COMPLETE);
  }

  @Test
  @DisplayName("Should report an error frame when the final write fails")
  void shouldReportPersistenceFailure() {
    // given
    FrameChannel channel = bridge.openChannel(true);
    bridge.enterStage(session, channel, GenerationState.GENERATING, "Writing");
    doThrow(new IllegalStateException("db down"))
        .when(messageStore)
        .finalizeMessage(any(), any());

    // when
    bridge.complete(session, channel, "primary");

    // then
    List<StreamFrame> frames = drain(channel);
    assertThat(frames.get(frames.size() - 1).getType()).isEqualTo(StreamFrame.ERROR);
    verify(workflowTokenService).invalidate("wf-1");
  }

  @Test
  @DisplayName("Should persist the stage before announcing it")
  void shouldPersistStage() {
    FrameChannel channel = bridge.openChannel(true);

    assertThat(bridge.enterStage(session, channel, GenerationState.SEARCHING, "Searching"))
        .isTrue();
    assertThat(bridge.enterStage(session, channel, GenerationState.DONE, "Done")).isFalse();

    verify(messageStore).updateState(session.getAssistantMessageId(), GenerationState.SEARCHING);
  }
}

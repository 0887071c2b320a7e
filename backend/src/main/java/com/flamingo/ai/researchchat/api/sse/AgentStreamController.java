package com.flamingo.ai.researchchat.api.sse;

import com.flamingo.ai.researchchat.api.dto.request.AgentStreamRequest;
import com.flamingo.ai.researchchat.api.dto.response.StreamFrame;
import com.flamingo.ai.researchchat.api.validation.AgentRequestSanitizer;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.service.generation.AgentRun;
import com.flamingo.ai.researchchat.service.generation.AgentRunService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** Controller streaming research-augmented answers as Server-Sent Events. */
@RestController
@RequestMapping("/api/ai/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentStreamController {

  static final String KEEPALIVE_COMMENT = "keepalive";

  private final AgentRunService agentRunService;
  private final AgentRequestSanitizer sanitizer;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  @PostConstruct
  void registerGauge() {
    meterRegistry.gauge("sse.connections.active", activeConnections);
  }

  /**
   * Starts a run and streams its frames.
   *
   * <p>Each frame is sent as an event named after its type. A comment line is written every
   * keepalive interval until the run's stream completes; it does not reset the generation
   * inactivity timeout.
   *
   * @param request the agent request
   * @return a Flux of SSE events
   */
  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ServerSentEvent<StreamFrame>> stream(@Valid @RequestBody AgentStreamRequest request) {
    AgentRun run = agentRunService.startStreaming(sanitizer.sanitize(request));
    log.info(
        "Streaming agent run {} for conversation {}",
        run.assistantMessageId(),
        request.getConversationId());
    activeConnections.incrementAndGet();

    Sinks.Empty<Void> framesDone = Sinks.empty();
    Flux<ServerSentEvent<StreamFrame>> frames =
        run.frames().map(AgentStreamController::toEvent).doFinally(s -> framesDone.tryEmitEmpty());
    Flux<ServerSentEvent<StreamFrame>> keepalive =
        Flux.interval(Duration.ofMillis(researchConfig.getStream().getKeepaliveIntervalMs()))
            .map(tick -> ServerSentEvent.<StreamFrame>builder().comment(KEEPALIVE_COMMENT).build())
            .takeUntilOther(framesDone.asMono());

    return frames
        .mergeWith(keepalive)
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Agent stream completed for message {}", run.assistantMessageId());
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error(
                  "Agent stream error for message {}: {}",
                  run.assistantMessageId(),
                  e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug(
                  "Agent stream cancelled for message {}, run continues in background",
                  run.assistantMessageId());
            });
  }

  static ServerSentEvent<StreamFrame> toEvent(StreamFrame frame) {
    return ServerSentEvent.builder(frame).event(frame.getType()).build();
  }
}

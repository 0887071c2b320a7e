package com.flamingo.ai.researchchat.service.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.exception.ProviderException;
import com.flamingo.ai.researchchat.service.stream.EventPersistenceBridge;
import com.flamingo.ai.researchchat.service.stream.FrameChannel;
import com.flamingo.ai.researchchat.service.stream.GenerationSession;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;

@ExtendWith(MockitoExtension.class)
@DisplayName("StreamingGenerator")
class StreamingGeneratorTest {

  private static final GenerationPrompt PROMPT =
      new GenerationPrompt("system", List.of(), "What is new?");
  private static final List<SearchResult> RESULTS =
      List.of(new SearchResult("Release notes", "https://example.com/notes", "Version 2", 0.9));

  @Mock private EventPersistenceBridge bridge;

  private ResearchConfig researchConfig;
  private GenerationSession session;
  private FrameChannel channel;

  @BeforeEach
  void setUp() {
    researchConfig = new ResearchConfig();
    session =
        new GenerationSession(
            UUID.randomUUID(), UUID.randomUUID(), "wf-1", "nonce", "What is new?");
    channel = FrameChannel.detached();
  }

  private StreamingGenerator generator(GenerationProvider... providers) {
    return new StreamingGenerator(
        List.of(providers),
        bridge,
        CircuitBreakerRegistry.ofDefaults(),
        researchConfig,
        new SimpleMeterRegistry(),
        () -> 0L);
  }

  @Test
  @DisplayName("Should persist a growing prefix and finish with the whole answer")
  void shouldPersistMonotonically() {
    // given
    StubProvider primary =
        new StubProvider(
            "primary",
            () ->
                Flux.just(GenerationChunk.content("Hello"), GenerationChunk.content(" world")));

    // when
    GenerationOutcome outcome = generator(primary).generate(session, channel, PROMPT, RESULTS);

    // then
    assertThat(outcome.success()).isTrue();
    assertThat(outcome.provider()).isEqualTo("primary");
    assertThat(session.getContent()).isEqualTo("Hello world");
    InOrder order = inOrder(bridge);
    order.verify(bridge).contentDelta(channel, "Hello");
    order.verify(bridge).persistContent(session, "Hello");
    order.verify(bridge).contentDelta(channel, " world");
    order.verify(bridge).persistContent(session, "Hello world");
  }

  @Test
  @DisplayName("Should keep partial content when the stream breaks after the first chunk")
  void shouldKeepPartialContentOnInterruption() {
    // given
    StubProvider primary =
        new StubProvider(
            "primary",
            () ->
                Flux.concat(
                    Flux.just(GenerationChunk.content("Hello")),
                    Flux.error(new ProviderException("primary", "connection reset"))));
    StubProvider secondary =
        new StubProvider("secondary", () -> Flux.just(GenerationChunk.content("Other")));

    // when
    GenerationOutcome outcome =
        generator(primary, secondary).generate(session, channel, PROMPT, RESULTS);

    // then
    assertThat(outcome.success()).isFalse();
    assertThat(outcome.failure()).isEqualTo("primary: connection reset");
    assertThat(session.getContent()).isEqualTo("Hello");
    assertThat(secondary.calls.get()).isZero();
    verify(bridge).persistContent(session, "Hello");
    verify(bridge, never()).persistContent(eq(session), eq("HelloOther"));
  }

  @Test
  @DisplayName("Should fall back to the secondary provider before any content")
  void shouldFallBackToSecondary() {
    // given
    StubProvider primary =
        new StubProvider(
            "primary", () -> Flux.error(new ProviderException("primary", "HTTP 503")));
    StubProvider secondary =
        new StubProvider(
            "secondary",
            () ->
                Flux.just(
                    GenerationChunk.reasoning("Thinking"), GenerationChunk.content("Answer")));

    // when
    GenerationOutcome outcome =
        generator(primary, secondary).generate(session, channel, PROMPT, RESULTS);

    // then
    assertThat(outcome.success()).isTrue();
    assertThat(outcome.provider()).isEqualTo("secondary");
    assertThat(outcome.attempts()).containsExactly("primary: HTTP 503");
    assertThat(session.getContent()).isEqualTo("Answer");
    assertThat(session.getReasoning()).isEqualTo("Thinking");
    verify(bridge).reasoningDelta(channel, "Thinking");
    verify(bridge).persistReasoning(session, "Thinking");
  }

  @Test
  @DisplayName("Should answer from search snippets when every provider fails")
  void shouldSynthesizeFromSnippets() {
    // given
    StubProvider primary =
        new StubProvider("primary", () -> Flux.error(new IllegalStateException("boom")));
    StubProvider secondary = new StubProvider("secondary", Flux::empty);

    // when
    GenerationOutcome outcome =
        generator(primary, secondary).generate(session, channel, PROMPT, RESULTS);

    // then
    assertThat(outcome.success()).isTrue();
    assertThat(outcome.provider()).isEqualTo(GenerationOutcome.SNIPPETS);
    assertThat(outcome.attempts())
        .containsExactly("primary: IllegalStateException: boom", "secondary: empty response");
    assertThat(session.getContent()).startsWith("Based on the search results I found:");
    assertThat(session.getContent()).contains("[example.com]");
    verify(bridge).contentWhole(eq(channel), startsWith("Based on the search results"));
  }

  @Test
  @DisplayName("Should skip providers that are not configured")
  void shouldSkipUnconfiguredProvider() {
    StubProvider primary = new StubProvider("primary", () -> Flux.just(content("unused")));
    primary.configured = false;
    StubProvider secondary = new StubProvider("secondary", () -> Flux.just(content("Hi")));

    GenerationOutcome outcome =
        generator(primary, secondary).generate(session, channel, PROMPT, RESULTS);

    assertThat(outcome.provider()).isEqualTo("secondary");
    assertThat(outcome.attempts()).containsExactly("primary: not configured");
    assertThat(primary.calls.get()).isZero();
  }

  @Test
  @DisplayName("Should end a stalled stream after the inactivity timeout")
  void shouldTimeOutStalledStream() {
    // given
    researchConfig.getStream().setInactivityTimeoutMs(50);
    StubProvider primary =
        new StubProvider(
            "primary", () -> Flux.concat(Flux.just(content("Partial")), Flux.never()));

    // when
    GenerationOutcome outcome = generator(primary).generate(session, channel, PROMPT, RESULTS);

    // then
    assertThat(outcome.success()).isFalse();
    assertThat(outcome.failure()).startsWith("Stream timed out");
    assertThat(session.getContent()).isEqualTo("Partial");
    verify(bridge, never()).contentWhole(any(), anyString());
  }

  private static GenerationChunk content(String text) {
    return GenerationChunk.content(text);
  }

  private static final class StubProvider implements GenerationProvider {

    private final String name;
    private final Supplier<Flux<GenerationChunk>> stream;
    private final AtomicInteger calls = new AtomicInteger();
    private boolean configured = true;

    StubProvider(String name, Supplier<Flux<GenerationChunk>> stream) {
      this.name = name;
      this.stream = stream;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public boolean isConfigured() {
      return configured;
    }

    @Override
    public Flux<GenerationChunk> stream(GenerationPrompt prompt) {
      calls.incrementAndGet();
      return stream.get();
    }
  }
}

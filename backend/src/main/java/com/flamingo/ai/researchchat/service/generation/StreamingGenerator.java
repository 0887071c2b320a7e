package com.flamingo.ai.researchchat.service.generation;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.exception.LlmServiceException;
import com.flamingo.ai.researchchat.exception.ProviderException;
import com.flamingo.ai.researchchat.exception.StreamTimeoutException;
import com.flamingo.ai.researchchat.service.stream.EventPersistenceBridge;
import com.flamingo.ai.researchchat.service.stream.FrameChannel;
import com.flamingo.ai.researchchat.service.stream.GenerationSession;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;

/**
 * Streams an answer into a session through the provider chain.
 *
 * <p>Each chunk is forwarded as a frame at once while persistence is batched. A provider that
 * fails before producing any content hands over to the next one; once content exists a failure
 * ends the run with the partial answer kept. When no provider answers, the answer is synthesized
 * from the search snippets.
 */
@Component
@Slf4j
public class StreamingGenerator {

  private final List<GenerationProvider> providers;
  private final EventPersistenceBridge bridge;
  private final CircuitBreakerRegistry circuitBreakerRegistry;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;
  private final LongSupplier nanoClock;

  @Autowired
  public StreamingGenerator(
      List<GenerationProvider> providers,
      EventPersistenceBridge bridge,
      CircuitBreakerRegistry circuitBreakerRegistry,
      ResearchConfig researchConfig,
      MeterRegistry meterRegistry) {
    this(
        providers,
        bridge,
        circuitBreakerRegistry,
        researchConfig,
        meterRegistry,
        System::nanoTime);
  }

  StreamingGenerator(
      List<GenerationProvider> providers,
      EventPersistenceBridge bridge,
      CircuitBreakerRegistry circuitBreakerRegistry,
      ResearchConfig researchConfig,
      MeterRegistry meterRegistry,
      LongSupplier nanoClock) {
    this.providers = providers;
    this.bridge = bridge;
    this.circuitBreakerRegistry = circuitBreakerRegistry;
    this.researchConfig = researchConfig;
    this.meterRegistry = meterRegistry;
    this.nanoClock = nanoClock;
  }

  /**
   * Streams the answer for {@code prompt} into {@code session}. Never throws; the outcome says
   * whether the answer is complete.
   *
   * @param results search results used for the snippet fallback
   */
  public GenerationOutcome generate(
      GenerationSession session,
      FrameChannel channel,
      GenerationPrompt prompt,
      List<SearchResult> results) {
    ResearchConfig.Generation config = researchConfig.getGeneration();
    Duration inactivity = Duration.ofMillis(researchConfig.getStream().getInactivityTimeoutMs());
    Duration flushInterval = Duration.ofMillis(config.getFlushIntervalMs());
    ContentBatcher contentBatcher =
        new ContentBatcher(
            flushInterval, nanoClock, content -> bridge.persistContent(session, content));
    ContentBatcher reasoningBatcher =
        new ContentBatcher(
            flushInterval, nanoClock, reasoning -> bridge.persistReasoning(session, reasoning));
    List<String> attempts = new ArrayList<>();

    for (GenerationProvider provider : providers) {
      if (!provider.isConfigured()) {
        attempts.add(provider.name() + ": not configured");
        continue;
      }
      CircuitBreaker breaker =
          circuitBreakerRegistry.circuitBreaker("generation-" + provider.name());
      if (!breaker.tryAcquirePermission()) {
        log.warn("Generation provider {} skipped, circuit open", provider.name());
        attempts.add(provider.name() + ": circuit open");
        continue;
      }

      long start = nanoClock.getAsLong();
      try {
        provider
            .stream(prompt)
            .timeout(inactivity)
            .doOnNext(
                chunk -> accept(session, channel, chunk, contentBatcher, reasoningBatcher))
            .then()
            .block();
        breaker.onSuccess(nanoClock.getAsLong() - start, TimeUnit.NANOSECONDS);
        contentBatcher.flush();
        reasoningBatcher.flush();
        if (session.hasContent()) {
          meterRegistry
              .counter("generation.provider.success", "provider", provider.name())
              .increment();
          return GenerationOutcome.success(provider.name(), attempts);
        }
        attempts.add(provider.name() + ": empty response");
      } catch (RuntimeException e) {
        breaker.onError(nanoClock.getAsLong() - start, TimeUnit.NANOSECONDS, e);
        contentBatcher.flush();
        reasoningBatcher.flush();
        String reason = describe(Exceptions.unwrap(e), inactivity);
        meterRegistry
            .counter("generation.provider.failures", "provider", provider.name())
            .increment();
        log.warn(
            "Generation provider {} failed for message {}: {}",
            provider.name(),
            session.getAssistantMessageId(),
            reason);
        attempts.add(
            reason.startsWith(provider.name() + ":") ? reason : provider.name() + ": " + reason);
        if (session.hasContent()) {
          return GenerationOutcome.interrupted(provider.name(), reason, attempts);
        }
      }
    }

    log.warn(
        "No generation provider answered for message {}, using search snippets",
        session.getAssistantMessageId());
    meterRegistry.counter("generation.snippet_fallback").increment();
    String answer =
        SnippetAnswerSynthesizer.synthesize(
            results, session.getUserMessage(), config.getSnippetAnswerMaxChars());
    bridge.persistContent(session, session.appendContent(answer));
    bridge.contentWhole(channel, answer);
    return GenerationOutcome.success(GenerationOutcome.SNIPPETS, attempts);
  }

  private void accept(
      GenerationSession session,
      FrameChannel channel,
      GenerationChunk chunk,
      ContentBatcher contentBatcher,
      ContentBatcher reasoningBatcher) {
    if (chunk.text() == null || chunk.text().isEmpty()) {
      return;
    }
    if (chunk.type() == GenerationChunk.Type.REASONING) {
      String reasoning = session.appendReasoning(chunk.text());
      bridge.reasoningDelta(channel, chunk.text());
      reasoningBatcher.offer(reasoning);
    } else {
      String content = session.appendContent(chunk.text());
      bridge.contentDelta(channel, chunk.text());
      contentBatcher.offer(content);
    }
  }

  private static String describe(Throwable error, Duration inactivity) {
    if (error instanceof TimeoutException) {
      return new StreamTimeoutException(inactivity).getMessage();
    }
    if (error instanceof ProviderException || error instanceof LlmServiceException) {
      return error.getMessage();
    }
    String message = error.getMessage();
    return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
  }
}

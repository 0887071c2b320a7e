package com.flamingo.ai.researchchat.service.generation;

import reactor.core.publisher.Flux;

/**
 * A model backend that streams answers. Providers are tried in {@link
 * org.springframework.core.annotation.Order} order until one produces output.
 */
public interface GenerationProvider {

  String name();

  boolean isConfigured();

  /** Streams the answer; the flux errors when the backend fails. */
  Flux<GenerationChunk> stream(GenerationPrompt prompt);
}

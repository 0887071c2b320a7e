package com.flamingo.ai.researchchat.service.generation.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.enums.MessageRole;
import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import com.flamingo.ai.researchchat.exception.ProviderException;
import com.flamingo.ai.researchchat.service.generation.GenerationChunk;
import com.flamingo.ai.researchchat.service.generation.GenerationPrompt;
import com.flamingo.ai.researchchat.service.generation.GenerationProvider;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

/**
 * Secondary answer model on an OpenAI-compatible streaming endpoint (OpenRouter by default).
 *
 * <p>Reads {@code choices[0].delta.content} and {@code choices[0].delta.reasoning} from each event
 * until the {@code [DONE]} sentinel.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class OpenRouterGenerationProvider implements GenerationProvider {

  static final String DONE = "[DONE]";
  private static final ParameterizedTypeReference<ServerSentEvent<String>> EVENT_TYPE =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final ResearchConfig researchConfig;

  @Override
  public String name() {
    return "secondary";
  }

  @Override
  public boolean isConfigured() {
    return StringUtils.hasText(researchConfig.getSearch().getOpenRouterApiKey());
  }

  @Override
  public Flux<GenerationChunk> stream(GenerationPrompt prompt) {
    ResearchConfig.Generation config = researchConfig.getGeneration();
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("model", config.getSecondaryModel());
    request.put("messages", toMessages(prompt));
    request.put("stream", true);
    request.put("temperature", 0.7);

    return webClient
        .post()
        .uri(config.getSecondaryProviderUrl())
        .headers(headers -> headers.setBearerAuth(researchConfig.getSearch().getOpenRouterApiKey()))
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.TEXT_EVENT_STREAM)
        .bodyValue(request)
        .retrieve()
        .bodyToFlux(EVENT_TYPE)
        .mapNotNull(ServerSentEvent::data)
        .map(String::trim)
        .filter(data -> !data.isEmpty())
        .takeWhile(data -> !DONE.equals(data))
        .concatMapIterable(this::parseEvent);
  }

  /** Extracts the deltas carried by one event. */
  List<GenerationChunk> parseEvent(String data) {
    JsonNode event;
    try {
      event = objectMapper.readTree(data);
    } catch (JsonProcessingException e) {
      log.debug("Skipping malformed stream event from {}", name());
      return List.of();
    }
    if (event.hasNonNull("error")) {
      JsonNode error = event.get("error");
      String message = error.isObject() ? error.path("message").asText("error") : error.asText();
      throw new ProviderException(name(), message);
    }
    JsonNode delta = event.path("choices").path(0).path("delta");
    List<GenerationChunk> chunks = new ArrayList<>(2);
    String reasoning = delta.path("reasoning").asText("");
    if (!reasoning.isEmpty()) {
      chunks.add(GenerationChunk.reasoning(reasoning));
    }
    String content = delta.path("content").asText("");
    if (!content.isEmpty()) {
      chunks.add(GenerationChunk.content(content));
    }
    return chunks;
  }

  private static List<Map<String, String>> toMessages(GenerationPrompt prompt) {
    List<Map<String, String>> messages = new ArrayList<>();
    messages.add(Map.of("role", "system", "content", prompt.systemPrompt()));
    for (ConversationTurn turn : prompt.history()) {
      if (turn.role() == MessageRole.USER || turn.role() == MessageRole.ASSISTANT) {
        messages.add(Map.of("role", turn.role().label(), "content", turn.text()));
      }
    }
    messages.add(Map.of("role", "user", "content", prompt.userMessage()));
    return messages;
  }
}

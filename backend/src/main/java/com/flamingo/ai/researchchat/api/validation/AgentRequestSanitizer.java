package com.flamingo.ai.researchchat.api.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.researchchat.api.dto.request.AgentStreamRequest;
import com.flamingo.ai.researchchat.api.dto.request.ContextReferenceRequest;
import com.flamingo.ai.researchchat.domain.enums.ContextReferenceType;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import com.flamingo.ai.researchchat.exception.ValidationException;
import com.flamingo.ai.researchchat.service.generation.AgentRunRequest;
import com.flamingo.ai.researchchat.service.search.RelevanceScores;
import com.flamingo.ai.researchchat.service.search.UrlNormalizer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a raw agent request into an {@link AgentRunRequest}.
 *
 * <p>Control characters other than newline and tab are stripped everywhere. The message must stay
 * non-empty; the conversation context and reference fields are truncated to their caps, and
 * references with an unknown type are dropped. Reference scores are clamped to [0,1]; a score that
 * is not a number is dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentRequestSanitizer {

  static final int MAX_MESSAGE_CHARS = 10_000;
  static final int MAX_CONTEXT_CHARS = 5_000;
  static final int MAX_REFERENCES = 12;
  static final int MAX_TITLE_CHARS = 500;
  static final int MAX_URL_CHARS = 2_000;
  static final int MAX_ID_CHARS = 200;

  private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}&&[^\\n\\t]]");

  private final Clock clock;

  public AgentRunRequest sanitize(AgentStreamRequest request) {
    String message = clean(request.getMessage()).trim();
    if (message.isEmpty()) {
      throw new ValidationException("message", "Message is required");
    }
    if (message.length() > MAX_MESSAGE_CHARS) {
      throw new ValidationException(
          "message", "Message must not exceed " + MAX_MESSAGE_CHARS + " characters");
    }
    if (request.getConversationId() == null) {
      throw new ValidationException("conversationId", "Conversation ID is required");
    }

    String context = cap(clean(request.getConversationContext()).trim(), MAX_CONTEXT_CHARS);
    String sessionId = cap(clean(request.getSessionId()).trim(), MAX_ID_CHARS);

    return new AgentRunRequest(
        message,
        request.getConversationId(),
        sessionId.isEmpty() ? null : sessionId,
        context.isEmpty() ? null : context,
        sanitizeReferences(request.getContextReferences()));
  }

  List<ContextReference> sanitizeReferences(List<ContextReferenceRequest> references) {
    if (references == null || references.isEmpty()) {
      return List.of();
    }
    List<ContextReference> sanitized = new ArrayList<>();
    for (ContextReferenceRequest reference : references) {
      if (sanitized.size() == MAX_REFERENCES) {
        log.debug("Ignoring context references beyond the first {}", MAX_REFERENCES);
        break;
      }
      if (reference != null) {
        toReference(reference).ifPresent(sanitized::add);
      }
    }
    return sanitized;
  }

  private Optional<ContextReference> toReference(ContextReferenceRequest reference) {
    Optional<ContextReferenceType> type = ContextReferenceType.fromWireName(reference.getType());
    if (type.isEmpty()) {
      return Optional.empty();
    }
    String url = cap(clean(reference.getUrl()).trim(), MAX_URL_CHARS);
    String title = cap(clean(reference.getTitle()).trim(), MAX_TITLE_CHARS);
    String contextId = cap(clean(reference.getContextId()).trim(), MAX_ID_CHARS);
    Double score = RelevanceScores.sanitize(reference.getRelevanceScore());
    JsonNode rawTimestamp = reference.getTimestamp();
    long timestamp =
        rawTimestamp != null && rawTimestamp.isIntegralNumber() && rawTimestamp.asLong() > 0
            ? rawTimestamp.asLong()
            : clock.millis();
    return Optional.of(
        new ContextReference(
            contextId.isEmpty() ? null : contextId,
            type.get(),
            UrlNormalizer.isHttpUrl(url) ? url : null,
            title.isEmpty() ? null : title,
            timestamp,
            score,
            null));
  }

  static String clean(String value) {
    return value == null ? "" : CONTROL_CHARS.matcher(value).replaceAll("");
  }

  private static String cap(String value, int maxChars) {
    return value.length() > maxChars ? value.substring(0, maxChars) : value;
  }
}

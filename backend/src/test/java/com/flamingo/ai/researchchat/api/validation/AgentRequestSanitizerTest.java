package com.flamingo.ai.researchchat.api.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flamingo.ai.researchchat.api.dto.request.AgentStreamRequest;
import com.flamingo.ai.researchchat.api.dto.request.ContextReferenceRequest;
import com.flamingo.ai.researchchat.domain.enums.ContextReferenceType;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import com.flamingo.ai.researchchat.exception.ValidationException;
import com.flamingo.ai.researchchat.service.generation.AgentRunRequest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AgentRequestSanitizer")
class AgentRequestSanitizerTest {

  private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

  private AgentRequestSanitizer sanitizer;
  private UUID conversationId;

  @BeforeEach
  void setUp() {
    sanitizer = new AgentRequestSanitizer(Clock.fixed(NOW, ZoneOffset.UTC));
    conversationId = UUID.randomUUID();
  }

  private AgentStreamRequest.AgentStreamRequestBuilder request(String message) {
    return AgentStreamRequest.builder().message(message).conversationId(conversationId);
  }

  @Test
  @DisplayName("Should strip control characters but keep newlines and tabs")
  void shouldStripControlCharacters() {
    // when
    AgentRunRequest result =
        sanitizer.sanitize(request("  line one\u0000\u0007\nline\ttwo\u001b  ").build());

    // then
    assertThat(result.message()).isEqualTo("line one\nline\ttwo");
    assertThat(result.conversationId()).isEqualTo(conversationId);
  }

  @Test
  @DisplayName("Should reject a message that is empty after cleaning")
  void shouldRejectEmptyMessage() {
    assertThatThrownBy(() -> sanitizer.sanitize(request("\u0000 \u0001").build()))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Message is required");
  }

  @Test
  @DisplayName("Should reject an oversized message")
  void shouldRejectOversizedMessage() {
    String message = "a".repeat(AgentRequestSanitizer.MAX_MESSAGE_CHARS + 1);

    assertThatThrownBy(() -> sanitizer.sanitize(request(message).build()))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  @DisplayName("Should measure the message length after control characters are stripped")
  void shouldAcceptPaddedMessageWithinLimit() {
    // given
    String message =
        "a".repeat(AgentRequestSanitizer.MAX_MESSAGE_CHARS) + "\u0000".repeat(50);

    // when
    AgentRunRequest result = sanitizer.sanitize(request(message).build());

    // then
    assertThat(result.message()).hasSize(AgentRequestSanitizer.MAX_MESSAGE_CHARS);
  }

  @Test
  @DisplayName("Should require a conversation id")
  void shouldRequireConversationId() {
    AgentStreamRequest request = AgentStreamRequest.builder().message("Hello").build();

    assertThatThrownBy(() -> sanitizer.sanitize(request))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  @DisplayName("Should truncate the context and drop blank optional fields")
  void shouldCapContext() {
    // when
    AgentRunRequest capped =
        sanitizer.sanitize(request("Hi").conversationContext("x".repeat(6_000)).build());
    AgentRunRequest blank =
        sanitizer.sanitize(request("Hi").conversationContext("  ").sessionId(" ").build());

    // then
    assertThat(capped.conversationContext()).hasSize(AgentRequestSanitizer.MAX_CONTEXT_CHARS);
    assertThat(blank.conversationContext()).isNull();
    assertThat(blank.sessionId()).isNull();
    assertThat(blank.contextReferences()).isEmpty();
  }

  @Test
  @DisplayName("Should coerce reference fields and drop unknown types")
  void shouldSanitizeReferences() {
    // given
    List<ContextReferenceRequest> references =
        List.of(
            ContextReferenceRequest.builder()
                .contextId("ref-1")
                .type("search_result")
                .url("javascript:alert(1)")
                .title("T".repeat(600))
                .relevanceScore(DoubleNode.valueOf(1.5))
                .build(),
            ContextReferenceRequest.builder().type("bookmark").url("https://a.example").build(),
            ContextReferenceRequest.builder()
                .type("scraped_page")
                .url("https://docs.example.com/page")
                .timestamp(LongNode.valueOf(1_700_000_000_000L))
                .relevanceScore(DoubleNode.valueOf(0.4))
                .build());

    // when
    List<ContextReference> result = sanitizer.sanitizeReferences(references);

    // then
    assertThat(result).hasSize(2);
    ContextReference first = result.get(0);
    assertThat(first.type()).isEqualTo(ContextReferenceType.SEARCH_RESULT);
    assertThat(first.url()).isNull();
    assertThat(first.title()).hasSize(AgentRequestSanitizer.MAX_TITLE_CHARS);
    assertThat(first.relevanceScore()).isEqualTo(1.0);
    assertThat(first.timestamp()).isEqualTo(NOW.toEpochMilli());
    ContextReference second = result.get(1);
    assertThat(second.url()).isEqualTo("https://docs.example.com/page");
    assertThat(second.timestamp()).isEqualTo(1_700_000_000_000L);
    assertThat(second.relevanceScore()).isEqualTo(0.4);
    assertThat(second.contextId()).isNull();
  }

  @Test
  @DisplayName("Should clamp out-of-range scores and drop non-numeric ones")
  void shouldClampScores() {
    // given
    List<ContextReferenceRequest> references =
        List.of(
            reference(DoubleNode.valueOf(5.0)),
            reference(DoubleNode.valueOf(-0.5)),
            reference(TextNode.valueOf("high")),
            reference(DoubleNode.valueOf(0.25)));

    // when
    List<ContextReference> result = sanitizer.sanitizeReferences(references);

    // then
    assertThat(result)
        .extracting(ContextReference::relevanceScore)
        .containsExactly(1.0, 0.0, null, 0.25);
  }

  @Test
  @DisplayName("Should bind loosely typed reference fields without rejecting the request")
  void shouldBindLooselyTypedFields() throws Exception {
    // given
    String json =
        "{\"message\":\"Hi\",\"conversationId\":\""
            + conversationId
            + "\",\"contextReferences\":[{\"type\":\"search_result\","
            + "\"url\":\"https://example.com\",\"relevanceScore\":\"high\","
            + "\"timestamp\":\"yesterday\"}]}";

    // when
    AgentStreamRequest request = new ObjectMapper().readValue(json, AgentStreamRequest.class);
    AgentRunRequest result = sanitizer.sanitize(request);

    // then
    assertThat(result.contextReferences()).hasSize(1);
    ContextReference reference = result.contextReferences().get(0);
    assertThat(reference.relevanceScore()).isNull();
    assertThat(reference.timestamp()).isEqualTo(NOW.toEpochMilli());
    assertThat(reference.url()).isEqualTo("https://example.com");
  }

  private static ContextReferenceRequest reference(JsonNode score) {
    return ContextReferenceRequest.builder()
        .type("search_result")
        .url("https://example.com/page")
        .relevanceScore(score)
        .build();
  }

  @Test
  @DisplayName("Should keep at most the configured number of references")
  void shouldCapReferenceCount() {
    // given
    List<ContextReferenceRequest> references = new ArrayList<>();
    IntStream.range(0, 20)
        .forEach(
            i ->
                references.add(
                    ContextReferenceRequest.builder()
                        .type("research_summary")
                        .title("Note " + i)
                        .build()));

    // when
    List<ContextReference> result = sanitizer.sanitizeReferences(references);

    // then
    assertThat(result).hasSize(AgentRequestSanitizer.MAX_REFERENCES);
    assertThat(result.get(11).title()).isEqualTo("Note 11");
  }
}

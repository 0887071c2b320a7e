package com.flamingo.ai.researchchat.api.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Typed frame written to the agent event stream. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamFrame {

  public static final String PROGRESS = "progress";
  public static final String REASONING = "reasoning";
  public static final String CONTENT = "content";
  public static final String TOOL_RESULT = "tool_result";
  public static final String METADATA = "metadata";
  public static final String ERROR = "error";
  public static final String COMPLETE = "complete";
  public static final String PERSISTED = "persisted";

  /** Frame type, one of the constants above. */
  private String type;

  /** Frame data (JSON object). */
  private Object data;

  public static StreamFrame progress(String stage, String message) {
    return StreamFrame.builder().type(PROGRESS).data(new ProgressData(stage, message)).build();
  }

  public static StreamFrame reasoning(String content) {
    return StreamFrame.builder().type(REASONING).data(new ReasoningData(content)).build();
  }

  /** Creates a content frame carrying only the new text. */
  public static StreamFrame contentDelta(String delta) {
    return StreamFrame.builder().type(CONTENT).data(new ContentData(null, delta)).build();
  }

  /** Creates a content frame carrying the whole answer, used when it was not streamed. */
  public static StreamFrame content(String content) {
    return StreamFrame.builder().type(CONTENT).data(new ContentData(content, null)).build();
  }

  public static StreamFrame toolResult(String toolName, Object result, long durationMs) {
    return StreamFrame.builder()
        .type(TOOL_RESULT)
        .data(new ToolResultData(toolName, result, durationMs))
        .build();
  }

  public static StreamFrame metadata(
      List<SearchResult> sources,
      List<ContextReference> contextReferences,
      double confidence,
      String completeness) {
    return StreamFrame.builder()
        .type(METADATA)
        .data(
            new MetadataData(
                sources != null ? sources : List.of(),
                contextReferences != null ? contextReferences : List.of(),
                confidence,
                completeness))
        .build();
  }

  public static StreamFrame error(String errorId, String error) {
    return StreamFrame.builder().type(ERROR).data(new ErrorData(errorId, error)).build();
  }

  public static StreamFrame complete(
      String assistantMessageId, String workflowId, String provider, int contentLength) {
    return StreamFrame.builder()
        .type(COMPLETE)
        .data(new CompleteData(assistantMessageId, workflowId, provider, contentLength))
        .build();
  }

  public static StreamFrame persisted(PersistedPayload payload, String nonce, String signature) {
    return StreamFrame.builder()
        .type(PERSISTED)
        .data(new PersistedData(payload, nonce, signature))
        .build();
  }

  /** Whether this frame ends the stream. */
  @JsonIgnore
  public boolean isTerminal() {
    return ERROR.equals(type) || COMPLETE.equals(type);
  }

  /** Progress event data. */
  @Data
  @AllArgsConstructor
  public static class ProgressData {
    private String stage;
    private String message;
  }

  /** Reasoning event data. */
  @Data
  @AllArgsConstructor
  public static class ReasoningData {
    private String content;
  }

  /** Content event data; exactly one of the fields is set. */
  @Data
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ContentData {
    private String content;
    private String delta;
  }

  /** Tool result event data. */
  @Data
  @AllArgsConstructor
  public static class ToolResultData {
    private String toolName;
    private Object result;
    private long durationMs;
  }

  /** Metadata event data. */
  @Data
  @AllArgsConstructor
  public static class MetadataData {
    private List<SearchResult> sources;
    private List<ContextReference> contextReferences;
    private double confidence;

    /** Either {@code complete} or {@code partial}. */
    private String completeness;
  }

  /** Error event data. */
  @Data
  @AllArgsConstructor
  public static class ErrorData {
    private String errorId;
    private String error;
  }

  /** Complete event data. */
  @Data
  @AllArgsConstructor
  public static class CompleteData {
    private String assistantMessageId;
    private String workflowId;
    private String provider;
    private int contentLength;
  }

  /** Persisted event data. */
  @Data
  @AllArgsConstructor
  public static class PersistedData {
    private PersistedPayload payload;
    private String nonce;
    private String signature;
  }
}

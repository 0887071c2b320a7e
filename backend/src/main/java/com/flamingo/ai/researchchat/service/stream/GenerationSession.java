package com.flamingo.ai.researchchat.service.stream;

import com.flamingo.ai.researchchat.domain.enums.GenerationState;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Getter;

/**
 * In-memory state of one generation run.
 *
 * <p>The streamed content only grows. Terminal states are final; a second terminal transition is
 * refused, which is what makes completion and failure mutually exclusive.
 */
public class GenerationSession {

  @Getter private final UUID id = UUID.randomUUID();
  @Getter private final UUID conversationId;
  @Getter private final UUID assistantMessageId;
  @Getter private final String workflowId;
  @Getter private final String nonce;
  @Getter private final String userMessage;

  private GenerationState state = GenerationState.PLANNING;
  private final StringBuilder content = new StringBuilder();
  private final StringBuilder reasoning = new StringBuilder();
  private final List<SearchResult> sources = new ArrayList<>();
  private final List<ContextReference> contextReferences = new ArrayList<>();
  private final List<String> errorDetails = new ArrayList<>();

  public GenerationSession(
      UUID conversationId,
      UUID assistantMessageId,
      String workflowId,
      String nonce,
      String userMessage) {
    this.conversationId = conversationId;
    this.assistantMessageId = assistantMessageId;
    this.workflowId = workflowId;
    this.nonce = nonce;
    this.userMessage = userMessage;
  }

  public synchronized GenerationState getState() {
    return state;
  }

  /**
   * Moves to {@code next}.
   *
   * @return {@code false} when the transition is not allowed from the current state
   */
  public synchronized boolean transitionTo(GenerationState next) {
    if (!state.canTransitionTo(next)) {
      return false;
    }
    state = next;
    return true;
  }

  public synchronized boolean isTerminal() {
    return state.isTerminal();
  }

  /** Appends a content delta and returns the whole content so far. */
  public synchronized String appendContent(String delta) {
    content.append(delta);
    return content.toString();
  }

  public synchronized String getContent() {
    return content.toString();
  }

  public synchronized boolean hasContent() {
    return content.length() > 0;
  }

  /** Appends a reasoning delta and returns the whole trace so far. */
  public synchronized String appendReasoning(String delta) {
    reasoning.append(delta);
    return reasoning.toString();
  }

  /** Returns the reasoning trace, or {@code null} when none was streamed. */
  public synchronized String getReasoning() {
    return reasoning.length() == 0 ? null : reasoning.toString();
  }

  public synchronized void setSources(List<SearchResult> results) {
    sources.clear();
    sources.addAll(results);
  }

  public synchronized List<SearchResult> getSources() {
    return List.copyOf(sources);
  }

  public synchronized void setContextReferences(List<ContextReference> references) {
    contextReferences.clear();
    contextReferences.addAll(references);
  }

  public synchronized List<ContextReference> getContextReferences() {
    return List.copyOf(contextReferences);
  }

  public synchronized void addError(String error) {
    errorDetails.add(error);
  }

  public synchronized List<String> getErrorDetails() {
    return List.copyOf(errorDetails);
  }
}

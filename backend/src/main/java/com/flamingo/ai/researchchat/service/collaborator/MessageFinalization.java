package com.flamingo.ai.researchchat.service.collaborator;

import com.flamingo.ai.researchchat.domain.enums.GenerationState;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import java.util.List;

/**
 * Terminal values written to an assistant message.
 *
 * @param state {@code DONE} or {@code ERROR}
 * @param content final answer, or the partial answer kept after a failure
 * @param reasoning reasoning trace, may be null
 * @param sources source URLs in display order
 * @param contextReferences provenance of the answer
 * @param errorDetails failure descriptions, empty on success
 */
public record MessageFinalization(
    GenerationState state,
    String content,
    String reasoning,
    List<String> sources,
    List<ContextReference> contextReferences,
    List<String> errorDetails) {

  public MessageFinalization {
    if (state == null || !state.isTerminal()) {
      throw new IllegalArgumentException("Finalization requires a terminal state: " + state);
    }
    content = content == null ? "" : content;
    sources = sources == null ? List.of() : List.copyOf(sources);
    contextReferences = contextReferences == null ? List.of() : List.copyOf(contextReferences);
    errorDetails = errorDetails == null ? List.of() : List.copyOf(errorDetails);
  }
}

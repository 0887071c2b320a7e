package com.flamingo.ai.researchchat.api.dto.response;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Final state of a generation run as announced to out-of-band listeners.
 *
 * <p>The property order is fixed because the signature covers the serialized form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
  "assistantMessageId",
  "workflowId",
  "conversationId",
  "answer",
  "sources",
  "contextReferences"
})
public class PersistedPayload {

  private String assistantMessageId;
  private String workflowId;
  private String conversationId;
  private String answer;
  private List<String> sources;
  private List<ContextReference> contextReferences;
}

package com.flamingo.ai.researchchat.api.dto.request;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Client-supplied provenance record. Fields are loosely typed and sanitized before use. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextReferenceRequest {

  private String contextId;

  /** One of {@code search_result}, {@code scraped_page}, {@code research_summary}. */
  private String type;

  private String url;
  private String title;

  /** Epoch millis; any other shape is replaced by the receive time. */
  private JsonNode timestamp;

  /** Kept raw so that a non-numeric score drops the field instead of failing the request. */
  private JsonNode relevanceScore;
}

package com.flamingo.ai.researchchat.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a standalone web search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 500, message = "Query must not exceed 500 characters")
  private String query;

  @Min(value = 1, message = "maxResults must be at least 1")
  @Max(value = 20, message = "maxResults must not exceed 20")
  private Integer maxResults;
}

package com.flamingo.ai.researchchat.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for reading a single page. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeRequest {

  @NotBlank(message = "URL is required")
  @Size(max = 2000, message = "URL must not exceed 2000 characters")
  private String url;
}

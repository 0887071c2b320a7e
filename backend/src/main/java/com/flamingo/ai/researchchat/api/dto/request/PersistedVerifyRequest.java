package com.flamingo.ai.researchchat.api.dto.request;

import com.flamingo.ai.researchchat.api.dto.response.PersistedPayload;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for acknowledging a signed persisted notification. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersistedVerifyRequest {

  @NotNull(message = "Payload is required")
  private PersistedPayload payload;

  @NotBlank(message = "Nonce is required")
  private String nonce;

  @NotBlank(message = "Signature is required")
  private String signature;
}

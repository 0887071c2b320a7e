package com.flamingo.ai.researchchat.service.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchchat.api.dto.response.PersistedPayload;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PayloadSigner")
class PayloadSignerTest {

  private ResearchConfig researchConfig;
  private PayloadSigner signer;

  @BeforeEach
  void setUp() {
    researchConfig = new ResearchConfig();
    researchConfig.getSigning().setSecret("top-secret");
    signer = new PayloadSigner(researchConfig, new ObjectMapper());
  }

  private static PersistedPayload payload(String answer) {
    return PersistedPayload.builder()
        .assistantMessageId("msg-1")
        .workflowId("wf-1")
        .answer(answer)
        .sources(List.of("https://example.com/a"))
        .contextReferences(List.of())
        .build();
  }

  @Test
  @DisplayName("Should sign the payload and nonce as one JSON envelope")
  void shouldSignEnvelope() {
    // given
    PersistedPayload payload = payload("Hello world");

    // when
    String canonical =
        new String(signer.canonicalBytes(payload, "abc123"), StandardCharsets.UTF_8);
    String signature = signer.sign(payload, "abc123");

    // then
    assertThat(canonical).startsWith("{\"payload\":{\"assistantMessageId\":\"msg-1\"");
    assertThat(canonical).endsWith(",\"nonce\":\"abc123\"}");
    assertThat(signature).hasSize(64).matches("[0-9a-f]+");
    assertThat(signer.sign(payload, "abc123")).isEqualTo(signature);
  }

  @Test
  @DisplayName("Should verify a genuine signature and reject any tampering")
  void shouldVerifySignature() {
    String signature = signer.sign(payload("Hello world"), "abc123");

    assertThat(signer.verify(payload("Hello world"), "abc123", signature)).isTrue();
    assertThat(signer.verify(payload("Hello world"), "abc123", signature.toUpperCase())).isTrue();
    assertThat(signer.verify(payload("Hello there"), "abc123", signature)).isFalse();
    assertThat(signer.verify(payload("Hello world"), "other", signature)).isFalse();
  }

  @Test
  @DisplayName("Should treat malformed signatures as invalid")
  void shouldRejectMalformedSignature() {
    assertThat(signer.verify(payload("Hello"), "abc123", "not-hex")).isFalse();
    assertThat(signer.verify(payload("Hello"), "abc123", "abcd")).isFalse();
    assertThat(signer.verify(payload("Hello"), "abc123", null)).isFalse();
  }

  @Test
  @DisplayName("Should be disabled without a secret")
  void shouldBeDisabledWithoutSecret() {
    researchConfig.getSigning().setSecret("");

    assertThat(signer.isEnabled()).isFalse();
    assertThat(signer.verify(payload("Hello"), "abc123", "00")).isFalse();
    assertThatThrownBy(() -> signer.sign(payload("Hello"), "abc123"))
        .isInstanceOf(IllegalStateException.class);
  }
}

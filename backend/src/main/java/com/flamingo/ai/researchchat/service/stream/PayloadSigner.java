package com.flamingo.ai.researchchat.service.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchchat.api.dto.response.PersistedPayload;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * HMAC-SHA256 signatures over persisted payloads.
 *
 * <p>The signed message is the compact JSON {@code {"payload":<payload>,"nonce":"<nonce>"}} and
 * the signature is lower-case hex. Signing is disabled while no secret is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PayloadSigner {

  private static final String ALGORITHM = "HmacSHA256";

  private final ResearchConfig researchConfig;
  private final ObjectMapper objectMapper;

  public boolean isEnabled() {
    String secret = researchConfig.getSigning().getSecret();
    return secret != null && !secret.isBlank();
  }

  /** Returns the hex signature of {@code payload} bound to {@code nonce}. */
  public String sign(PersistedPayload payload, String nonce) {
    if (!isEnabled()) {
      throw new IllegalStateException("Payload signing secret is not configured");
    }
    return HexFormat.of().formatHex(mac(canonicalBytes(payload, nonce)));
  }

  /** Checks a signature in constant time. Malformed input verifies as {@code false}. */
  public boolean verify(PersistedPayload payload, String nonce, String signature) {
    if (!isEnabled() || payload == null || nonce == null || signature == null) {
      return false;
    }
    byte[] provided;
    try {
      provided = HexFormat.of().parseHex(signature.toLowerCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      log.warn("Rejected persisted payload with malformed signature");
      return false;
    }
    byte[] expected = mac(canonicalBytes(payload, nonce));
    return MessageDigest.isEqual(expected, provided);
  }

  byte[] canonicalBytes(PersistedPayload payload, String nonce) {
    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("payload", payload);
    envelope.put("nonce", nonce);
    try {
      return objectMapper.writeValueAsString(envelope).getBytes(StandardCharsets.UTF_8);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize persisted payload", e);
    }
  }

  private byte[] mac(byte[] message) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      byte[] key = researchConfig.getSigning().getSecret().getBytes(StandardCharsets.UTF_8);
      mac.init(new SecretKeySpec(key, ALGORITHM));
      return mac.doFinal(message);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("HMAC-SHA256 not available", e);
    }
  }
}

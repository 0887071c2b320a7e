package com.flamingo.ai.researchchat.service.planner;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.UUID;

/**
 * Deterministic key for a cacheable planning decision.
 *
 * <p>The value is {@code conversationId|sha256(message|count|lastCreatedAt)} so entries can be
 * dropped by conversation prefix.
 */
public record PlanFingerprint(UUID conversationId, String value) {

  static final int MESSAGE_PREFIX_CHARS = 200;

  public static PlanFingerprint of(
      UUID conversationId, String message, int messageCount, Instant lastCreatedAt) {
    String normalized = message == null ? "" : message.toLowerCase(Locale.ROOT).trim();
    if (normalized.length() > MESSAGE_PREFIX_CHARS) {
      normalized = normalized.substring(0, MESSAGE_PREFIX_CHARS);
    }
    long lastMillis = lastCreatedAt != null ? lastCreatedAt.toEpochMilli() : 0L;
    String material = normalized + "|" + messageCount + "|" + lastMillis;
    return new PlanFingerprint(conversationId, prefix(conversationId) + sha256(material));
  }

  static String prefix(UUID conversationId) {
    return conversationId + "|";
  }

  private static String sha256(String material) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}

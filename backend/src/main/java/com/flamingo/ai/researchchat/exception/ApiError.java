package com.flamingo.ai.researchchat.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String CONVERSATION_NOT_FOUND = "CONVERSATION_001";
  public static final String MESSAGE_NOT_FOUND = "CONVERSATION_002";
  public static final String ACCESS_DENIED = "AUTH_001";
  public static final String SIGNATURE_INVALID = "AUTH_002";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String SCRAPE_FAILED = "SCRAPE_001";
  public static final String SCRAPE_BLOCKED = "SCRAPE_002";
  public static final String GENERATION_CONFLICT = "GENERATION_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}

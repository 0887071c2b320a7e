package com.flamingo.ai.researchchat.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/** Kind of material a context reference points at. */
public enum ContextReferenceType {
  SEARCH_RESULT("search_result"),
  SCRAPED_PAGE("scraped_page"),
  RESEARCH_SUMMARY("research_summary");

  private final String wireName;

  ContextReferenceType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String getWireName() {
    return wireName;
  }

  /** Resolves a wire name, returning empty for unknown values. */
  public static Optional<ContextReferenceType> fromWireName(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(t -> t.wireName.equals(value)).findFirst();
  }

  @JsonCreator
  static ContextReferenceType fromJson(String value) {
    return fromWireName(value)
        .orElseThrow(
            () -> new IllegalArgumentException("Unknown context reference type: " + value));
  }
}

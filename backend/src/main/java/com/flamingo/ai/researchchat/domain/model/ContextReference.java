package com.flamingo.ai.researchchat.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.researchchat.domain.enums.ContextReferenceType;
import java.util.Map;

/** Provenance record linking an answer to the material it was built from. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextReference(
    String contextId,
    ContextReferenceType type,
    String url,
    String title,
    long timestamp,
    Double relevanceScore,
    Map<String, Object> metadata) {}

package com.flamingo.ai.researchchat.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import jakarta.persistence.Converter;

/** Persists context references attached to an assistant message. */
@Converter
public class ContextReferenceListConverter extends JsonListConverter<ContextReference> {

  public ContextReferenceListConverter() {
    super(new TypeReference<>() {});
  }
}

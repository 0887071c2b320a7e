package com.flamingo.ai.researchchat.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

/** Persists source URLs and error details as a JSON array. */
@Converter
public class StringListConverter extends JsonListConverter<String> {

  public StringListConverter() {
    super(new TypeReference<>() {});
  }
}

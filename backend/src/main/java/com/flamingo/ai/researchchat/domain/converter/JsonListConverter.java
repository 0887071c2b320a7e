package com.flamingo.ai.researchchat.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Base JPA converter persisting a list as a JSON array in a TEXT column. */
@Slf4j
abstract class JsonListConverter<T> implements AttributeConverter<List<T>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final TypeReference<List<T>> listType;

  protected JsonListConverter(TypeReference<List<T>> listType) {
    this.listType = listType;
  }

  @Override
  public String convertToDatabaseColumn(List<T> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize list column: {}", e.getMessage());
      return null;
    }
  }

  @Override
  public List<T> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return Collections.emptyList();
    }
    try {
      return MAPPER.readValue(dbData, listType);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize list column: {}", e.getMessage());
      return Collections.emptyList();
    }
  }
}

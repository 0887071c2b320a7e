package com.flamingo.ai.researchchat.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import jakarta.persistence.Converter;

/** Persists search results attached to an assistant message. */
@Converter
public class SearchResultListConverter extends JsonListConverter<SearchResult> {

  public SearchResultListConverter() {
    super(new TypeReference<>() {});
  }
}

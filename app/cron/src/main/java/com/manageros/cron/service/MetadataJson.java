package com.manageros.cron.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Writes metadata maps into the jsonb columns. An absent map is stored as an empty object. */
@Component
@RequiredArgsConstructor
public class MetadataJson {

  private static final String EMPTY_OBJECT = "{}";

  private final ObjectMapper objectMapper;

  public String write(Map<String, Object> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return EMPTY_OBJECT;
    }
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException ex) {
      throw new MetadataSerializationException("metadata serialization failure", ex);
    }
  }
}

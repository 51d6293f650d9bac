package com.acme.voice.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;

public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  /**
   * Parse a JSON object into a mutable map, keeping numbers and nested values as Jackson reads
   * them.
   *
   * @throws IllegalArgumentException if the text is not a JSON object
   */
  public static Map<String, Object> readMap(String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("Empty JSON document");
    }
    Map<String, Object> map;
    try {
      map = M.readValue(json, MAP_TYPE);
    } catch (Exception e) {
      throw new IllegalArgumentException("Malformed JSON object: " + e.getMessage(), e);
    }
    if (map == null) {
      throw new IllegalArgumentException("JSON document is not an object");
    }
    return map;
  }
}

package io.b2mash.b2b.automation.store;

import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

/**
 * Serializes nested structures (trigger config, conditions, actions, reminder config) to and from
 * the JSON text stored in single columns. Only repositories use this; the rest of the engine works
 * with typed records.
 */
@Component
public class JsonColumns {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

  private final JsonMapper jsonMapper;

  public JsonColumns() {
    this.jsonMapper = JsonMapper.builder().build();
  }

  public String write(Object value) {
    try {
      return jsonMapper.writeValueAsString(value);
    } catch (JacksonException e) {
      throw new StoreException("Failed to serialize column value", e);
    }
  }

  /** Reads a JSON object column. Blank cells read as an empty map. */
  public Map<String, Object> readMap(Object cell) {
    if (cell instanceof Map<?, ?>) {
      @SuppressWarnings("unchecked")
      var map = (Map<String, Object>) cell;
      return map;
    }
    if (cell == null || cell.toString().isBlank()) {
      return Map.of();
    }
    try {
      return jsonMapper.readValue(cell.toString(), MAP_TYPE);
    } catch (JacksonException e) {
      throw new StoreException("Malformed JSON object column: " + e.getMessage(), e);
    }
  }

  /** Reads a JSON array column. Blank cells read as an empty list. */
  public List<Object> readList(Object cell) {
    if (cell instanceof List<?>) {
      @SuppressWarnings("unchecked")
      var list = (List<Object>) cell;
      return list;
    }
    if (cell == null || cell.toString().isBlank()) {
      return List.of();
    }
    try {
      return jsonMapper.readValue(cell.toString(), LIST_TYPE);
    } catch (JacksonException e) {
      throw new StoreException("Malformed JSON array column: " + e.getMessage(), e);
    }
  }
}

package com.flamingo.ai.contextlab.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A stored context as returned by {@link ContextStorage}.
 *
 * @param id context id
 * @param distance vector distance to the query; lower is closer
 * @param metadata stored metadata
 */
public record ContextRecord(String id, double distance, Map<String, Object> metadata) {

  public ContextRecord {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Returns a string field, or {@code null} when absent. */
  public String getString(String key) {
    Object value = metadata.get(key);
    return value == null ? null : value.toString();
  }

  /** Returns the stored tags; a non-list value yields an empty list. */
  public List<String> tags() {
    Object value = metadata.get("tags");
    if (!(value instanceof List<?>)) {
      return List.of();
    }
    return ((List<?>) value).stream().map(String::valueOf).toList();
  }
}

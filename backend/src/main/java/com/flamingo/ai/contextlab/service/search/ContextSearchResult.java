package com.flamingo.ai.contextlab.service.search;

import java.util.List;
import java.util.Map;

/**
 * A search hit enriched with its relevance score.
 *
 * @param id context id
 * @param distance storage distance
 * @param metadata stored metadata
 * @param relevanceScore {@code 1 - distance}
 * @param importance stored importance, 50 when absent
 */
public record ContextSearchResult(
    String id,
    double distance,
    Map<String, Object> metadata,
    double relevanceScore,
    int importance) {

  /** Returns the stored tags, or an empty list. */
  public List<String> tags() {
    Object value = metadata.get("tags");
    if (!(value instanceof List<?>)) {
      return List.of();
    }
    return ((List<?>) value).stream().map(String::valueOf).toList();
  }

  /** Returns the raw {@code created_time} string, or an empty string. */
  public String createdTime() {
    Object value = metadata.get("created_time");
    return value == null ? "" : value.toString();
  }
}

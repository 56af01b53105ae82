package com.flamingo.ai.contextlab.domain.model;

import com.flamingo.ai.contextlab.domain.enums.ContentFormat;
import com.flamingo.ai.contextlab.domain.enums.ContextSource;
import com.flamingo.ai.contextlab.domain.enums.ContextType;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Descriptive properties of a {@link ProcessedContext}.
 *
 * <p>{@code additionalMetadata} holds the processor's format-specific metadata plus a {@code
 * processor} entry naming the processor that produced the context. Values may be nested lists and
 * maps; the top-level map is unmodifiable.
 */
public record ContextProperties(
    ContextType contextType,
    ContextSource source,
    LocalDateTime createTime,
    LocalDateTime updateTime,
    String contentPath,
    ContentFormat contentFormat,
    String title,
    String summary,
    List<String> tags,
    Map<String, Object> additionalMetadata) {

  public ContextProperties {
    tags = tags == null ? List.of() : KeywordLists.distinct(tags);
    additionalMetadata =
        additionalMetadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(additionalMetadata));
  }

  /** Returns a copy with the given tags and additional metadata. */
  public ContextProperties withTagsAndMetadata(
      List<String> newTags, Map<String, Object> newAdditionalMetadata) {
    return new ContextProperties(
        contextType,
        source,
        createTime,
        LocalDateTime.now(),
        contentPath,
        contentFormat,
        title,
        summary,
        newTags,
        newAdditionalMetadata);
  }
}

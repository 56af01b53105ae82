package com.flamingo.ai.contextlab.domain.model;

import java.util.List;

/**
 * One semantically bounded text segment of a {@link ProcessedContext}.
 *
 * @param text segment content
 * @param chunkIndex position within the owning context, dense from 0
 * @param keywords ordered keywords describing the segment
 * @param entities ordered entity names found in the segment; may be empty
 */
public record Chunk(String text, int chunkIndex, List<String> keywords, List<String> entities) {

  public Chunk {
    keywords = keywords == null ? List.of() : KeywordLists.distinct(keywords);
    entities = entities == null ? List.of() : KeywordLists.distinct(entities);
  }

  public Chunk(String text, int chunkIndex, List<String> keywords) {
    this(text, chunkIndex, keywords, List.of());
  }
}

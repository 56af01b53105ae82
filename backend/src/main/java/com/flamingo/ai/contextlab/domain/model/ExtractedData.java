package com.flamingo.ai.contextlab.domain.model;

import com.flamingo.ai.contextlab.domain.enums.ContextType;
import java.util.List;

/**
 * Summary fields derived for a {@link ProcessedContext}, either heuristically by a processor or by
 * LLM enrichment.
 *
 * <p>{@code confidence} and {@code importance} are clamped to {@code [0, 100]}.
 */
public record ExtractedData(
    String title,
    String summary,
    List<String> keywords,
    List<String> entities,
    ContextType contextType,
    int confidence,
    int importance) {

  public ExtractedData {
    keywords = keywords == null ? List.of() : KeywordLists.distinct(keywords);
    entities = entities == null ? List.of() : KeywordLists.distinct(entities);
    confidence = clamp(confidence);
    importance = clamp(importance);
  }

  /** Returns a copy with the given keyword and entity lists. */
  public ExtractedData withKeywordsAndEntities(List<String> newKeywords, List<String> newEntities) {
    return new ExtractedData(
        title, summary, newKeywords, newEntities, contextType, confidence, importance);
  }

  private static int clamp(int value) {
    return Math.max(0, Math.min(100, value));
  }
}

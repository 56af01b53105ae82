package com.flamingo.ai.contextlab.agent.dto;

import java.util.List;

/** Cleaned output of one auto-tagging call. Every list holds at most 10 entries. */
public record GeneratedTags(
    List<String> topics, List<String> keywords, List<String> entities, List<String> categories) {

  public GeneratedTags {
    topics = topics == null ? List.of() : List.copyOf(topics);
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
    entities = entities == null ? List.of() : List.copyOf(entities);
    categories = categories == null ? List.of() : List.copyOf(categories);
  }

  /** The structure returned whenever tag generation fails. */
  public static GeneratedTags empty() {
    return new GeneratedTags(List.of(), List.of(), List.of(), List.of());
  }

  public boolean isEmpty() {
    return topics.isEmpty() && keywords.isEmpty() && entities.isEmpty() && categories.isEmpty();
  }
}

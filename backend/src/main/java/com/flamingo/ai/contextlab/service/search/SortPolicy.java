package com.flamingo.ai.contextlab.service.search;

/** Ordering applied to filtered search results. */
public enum SortPolicy {
  /** Highest relevance score first. */
  RELEVANCE,
  /** Newest {@code created_time} first. */
  DATE,
  /** Highest stored importance first. */
  IMPORTANCE
}

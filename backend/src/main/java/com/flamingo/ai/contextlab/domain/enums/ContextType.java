package com.flamingo.ai.contextlab.domain.enums;

/** Semantic classification of a processed context. */
public enum ContextType {
  /** Knowledge and facts extracted from documents, code and data files. */
  SEMANTIC_CONTEXT("semantic_context"),

  /** People, organizations, projects and other named things. */
  ENTITY_CONTEXT("entity_context"),

  /** What the user was doing at a point in time. */
  ACTIVITY_CONTEXT("activity_context"),

  /** Goals and plans. */
  INTENT_CONTEXT("intent_context"),

  /** How-to knowledge and workflows. */
  PROCEDURAL_CONTEXT("procedural_context"),

  /** Status snapshots. */
  STATE_CONTEXT("state_context");

  private final String value;

  ContextType(String value) {
    this.value = value;
  }

  /** Returns the value stored in the storage layer's {@code context_type} field. */
  public String getValue() {
    return value;
  }
}

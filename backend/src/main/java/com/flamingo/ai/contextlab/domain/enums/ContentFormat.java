package com.flamingo.ai.contextlab.domain.enums;

/** Physical format of a raw or processed context's content. */
public enum ContentFormat {
  TEXT,
  IMAGE,
  FILE
}

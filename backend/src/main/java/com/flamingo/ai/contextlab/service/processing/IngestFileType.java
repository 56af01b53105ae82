package com.flamingo.ai.contextlab.service.processing;

import java.util.Set;

/** Coarse file family reported for an ingested file, derived from its extension. */
public enum IngestFileType {
  EXCEL("excel"),
  STRUCTURED_DATA("structured_data"),
  CODE("code"),
  DOCUMENT("document"),
  IMAGE("image"),
  UNKNOWN("unknown");

  static final Set<String> DOCUMENT_EXTENSIONS = Set.of(".pdf", ".docx", ".doc", ".txt", ".md");
  static final Set<String> IMAGE_EXTENSIONS =
      Set.of(".png", ".jpg", ".jpeg", ".gif", ".bmp", ".webp");

  private final String value;

  IngestFileType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}

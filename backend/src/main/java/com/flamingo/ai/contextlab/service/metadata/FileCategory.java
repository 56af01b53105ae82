package com.flamingo.ai.contextlab.service.metadata;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/** File families that carry a format-specific metadata tier. */
public enum FileCategory {
  PDF(Set.of(".pdf")),
  DOCX(Set.of(".docx", ".doc")),
  XLSX(Set.of(".xlsx", ".xls")),
  IMAGE(Set.of(".png", ".jpg", ".jpeg", ".gif", ".bmp", ".webp")),
  CODE(Set.of(".py", ".js", ".java", ".cpp", ".c", ".go", ".rs"));

  private final Set<String> extensions;

  FileCategory(Set<String> extensions) {
    this.extensions = extensions;
  }

  public Set<String> getExtensions() {
    return extensions;
  }

  /**
   * Resolves the category for a lowercase extension with leading dot.
   *
   * @param extension file extension, e.g. {@code .pdf}
   * @return the category, or empty when the format has no dedicated tier
   */
  public static Optional<FileCategory> fromExtension(String extension) {
    return Arrays.stream(values()).filter(c -> c.extensions.contains(extension)).findFirst();
  }
}

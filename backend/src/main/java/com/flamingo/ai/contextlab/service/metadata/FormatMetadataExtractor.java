package com.flamingo.ai.contextlab.service.metadata;

import java.nio.file.Path;
import java.util.Map;

/**
 * Strategy for the format-specific metadata tier of one {@link FileCategory}.
 *
 * <p>Implementations may throw; {@link FileMetadataExtractor} logs the failure and keeps the
 * universal tier.
 */
public interface FormatMetadataExtractor {

  /** The category this extractor handles. */
  FileCategory getCategory();

  /**
   * Extracts format-specific fields, each key prefixed with the format name.
   *
   * @param filePath existing file
   * @return metadata fields; never {@code null}
   * @throws Exception when the file cannot be read as this format
   */
  Map<String, Object> extract(Path filePath) throws Exception;
}

package com.flamingo.ai.contextlab.service.ingestion;

import com.flamingo.ai.contextlab.service.processing.IngestFileType;
import java.util.List;

/**
 * Outcome of ingesting one file.
 *
 * @param filePath path as given by the caller
 * @param fileName file name
 * @param fileType coarse file family from the extension
 * @param status ingestion status
 * @param contextIds ids of the stored contexts; empty unless processed
 * @param message human-readable detail
 */
public record FileIngestionOutcome(
    String filePath,
    String fileName,
    IngestFileType fileType,
    IngestionStatus status,
    List<String> contextIds,
    String message) {

  public FileIngestionOutcome {
    contextIds = contextIds == null ? List.of() : List.copyOf(contextIds);
  }
}

package com.flamingo.ai.contextlab.service.ingestion;

import java.util.List;

/**
 * Summary of a batch or directory ingestion. The counts always cover every file; {@code results}
 * may be capped for directory runs.
 */
public record IngestionReport(
    int totalFiles, int processed, int skipped, int failed, List<FileIngestionOutcome> results) {

  public IngestionReport {
    results = results == null ? List.of() : List.copyOf(results);
  }

  static IngestionReport of(List<FileIngestionOutcome> outcomes, int maxReported) {
    int processed = 0;
    int skipped = 0;
    int failed = 0;
    for (FileIngestionOutcome outcome : outcomes) {
      switch (outcome.status()) {
        case PROCESSED -> processed++;
        case SKIPPED -> skipped++;
        case FAILED -> failed++;
        default -> throw new IllegalStateException("Unexpected status " + outcome.status());
      }
    }
    List<FileIngestionOutcome> reported =
        outcomes.size() > maxReported ? outcomes.subList(0, maxReported) : outcomes;
    return new IngestionReport(outcomes.size(), processed, skipped, failed, reported);
  }
}

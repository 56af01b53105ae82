package com.flamingo.ai.contextlab.service.ingestion;

/** Result of ingesting one file. */
public enum IngestionStatus {
  /** At least one context was produced and stored. */
  PROCESSED,
  /** No processor accepted the file, or the processor produced nothing. */
  SKIPPED,
  /** The file was missing or invalid, or storing its contexts failed. */
  FAILED
}

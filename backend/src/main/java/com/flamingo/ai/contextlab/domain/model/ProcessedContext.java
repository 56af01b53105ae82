package com.flamingo.ai.contextlab.domain.model;

import java.util.List;

/**
 * The unit of storage and search: one logical document or sub-document (for example one
 * spreadsheet sheet) bundling its chunks and metadata.
 *
 * <p>Instances are immutable once produced. Enrichment steps create new instances.
 *
 * @param id context id, derived from the raw object id
 * @param properties descriptive properties
 * @param chunks chunks in index order; never empty
 * @param extractedData derived summary fields
 */
public record ProcessedContext(
    String id, ContextProperties properties, List<Chunk> chunks, ExtractedData extractedData) {

  public ProcessedContext {
    if (chunks == null || chunks.isEmpty()) {
      throw new IllegalArgumentException(
          "ProcessedContext " + id + " must have at least one chunk");
    }
    for (int i = 0; i < chunks.size(); i++) {
      if (chunks.get(i).chunkIndex() != i) {
        throw new IllegalArgumentException(
            "Chunk indices of context "
                + id
                + " must be dense from 0, found "
                + chunks.get(i).chunkIndex()
                + " at position "
                + i);
      }
    }
    chunks = List.copyOf(chunks);
  }
}

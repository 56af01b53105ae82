package com.flamingo.ai.contextlab.service.processing;

import com.flamingo.ai.contextlab.domain.model.ProcessedContext;
import com.flamingo.ai.contextlab.domain.model.RawContextProperties;
import java.util.List;
import java.util.Set;

/**
 * Format-aware processor turning one raw captured file into processed contexts.
 *
 * <p>{@link ContextProcessorRouter} depends exclusively on this interface. To support a new file
 * family, implement it (usually by extending {@link AbstractContextProcessor}) and register it as
 * a Spring bean with an {@code @Order} that places it among the existing processors,
 * most-specific first.
 */
public interface ContextProcessor {

  /** Stable processor name, recorded in each context's {@code processor} metadata entry. */
  String getName();

  String getDescription();

  /**
   * Returns the lowercase file extensions (with leading dot) this processor handles.
   *
   * @return supported extensions
   */
  Set<String> getSupportedFormats();

  /**
   * Returns {@code true} if this processor can handle the raw context.
   *
   * @param raw raw context
   * @return whether {@link #process} should be called
   */
  boolean canProcess(RawContextProperties raw);

  /**
   * Processes the raw context.
   *
   * <p>Never throws: any failure is logged and yields an empty list.
   *
   * @param raw raw context whose {@code contentPath} references an existing file
   * @return processed contexts, each with at least one chunk; empty on failure
   */
  List<ProcessedContext> process(RawContextProperties raw);
}

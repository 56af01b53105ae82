package com.flamingo.ai.contextlab.service.processing;

import com.flamingo.ai.contextlab.domain.enums.ContentFormat;
import com.flamingo.ai.contextlab.domain.enums.ContextSource;
import com.flamingo.ai.contextlab.domain.enums.ContextType;
import com.flamingo.ai.contextlab.domain.model.Chunk;
import com.flamingo.ai.contextlab.domain.model.ContextProperties;
import com.flamingo.ai.contextlab.domain.model.ExtractedData;
import com.flamingo.ai.contextlab.domain.model.ProcessedContext;
import com.flamingo.ai.contextlab.domain.model.RawContextProperties;
import com.flamingo.ai.contextlab.exception.ContextProcessingException;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for file-based processors.
 *
 * <p>Implements the routing predicate shared by every processor and the exception isolation
 * contract: subclasses implement {@link #doProcess} and may throw freely, {@link #process} turns
 * every failure into a logged, empty result so that one malformed file never aborts a batch.
 */
@Slf4j
public abstract class AbstractContextProcessor implements ContextProcessor {

  private final MeterRegistry meterRegistry;

  protected AbstractContextProcessor(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /** Whether the processor is switched on in configuration. */
  protected abstract boolean isEnabled();

  /**
   * Parses and chunks the file. Implementations may throw; the caller isolates failures.
   *
   * @param raw raw context
   * @param filePath resolved content path
   * @return processed contexts
   * @throws Exception on any load or processing failure
   */
  protected abstract List<ProcessedContext> doProcess(RawContextProperties raw, Path filePath)
      throws Exception;

  @Override
  public boolean canProcess(RawContextProperties raw) {
    if (!isEnabled() || raw == null) {
      return false;
    }
    if (raw.source() != ContextSource.LOCAL_FILE) {
      return false;
    }
    if (raw.contentPath() == null || raw.contentPath().isBlank()) {
      return false;
    }
    Path filePath = Path.of(raw.contentPath());
    return Files.exists(filePath) && getSupportedFormats().contains(extensionOf(filePath));
  }

  @Override
  public final List<ProcessedContext> process(RawContextProperties raw) {
    try {
      Path filePath = Path.of(raw.contentPath());
      log.info("[{}] Processing file: {}", getName(), filePath);
      List<ProcessedContext> contexts = doProcess(raw, filePath);
      meterRegistry.counter("context.processing.success", "processor", getName()).increment();
      log.info("[{}] Processed {} into {} context(s)", getName(), filePath, contexts.size());
      return contexts;
    } catch (ContextProcessingException e) {
      meterRegistry.counter("context.processing.failure", "processor", getName()).increment();
      log.error(
          "[{}] Failed to load context {} from {}: {}",
          getName(),
          e.getObjectId(),
          e.getContentPath(),
          e.getMessage(),
          e);
      return List.of();
    } catch (Exception e) {
      meterRegistry.counter("context.processing.failure", "processor", getName()).increment();
      log.error(
          "[{}] Error processing file {}: {}",
          getName(),
          raw != null ? raw.contentPath() : null,
          e.getMessage(),
          e);
      return List.of();
    }
  }

  /**
   * Assembles a semantic-context result in the shape shared by all processors.
   *
   * @param id context id
   * @param raw originating raw context
   * @param chunks chunks in index order
   * @param title context title
   * @param summary context summary
   * @param keywords keywords, also used as tags
   * @param entities entity names
   * @param metadata format-specific metadata; the processor name is added to it
   * @param confidence heuristic confidence
   * @param importance heuristic importance
   * @return the processed context
   */
  protected ProcessedContext buildContext(
      String id,
      RawContextProperties raw,
      List<Chunk> chunks,
      String title,
      String summary,
      List<String> keywords,
      List<String> entities,
      Map<String, Object> metadata,
      int confidence,
      int importance) {
    LocalDateTime now = LocalDateTime.now();
    Map<String, Object> additionalMetadata = new LinkedHashMap<>(raw.metadata());
    additionalMetadata.putAll(metadata);
    additionalMetadata.put("processor", getName());

    ExtractedData extractedData =
        new ExtractedData(
            title,
            summary,
            keywords,
            entities,
            ContextType.SEMANTIC_CONTEXT,
            confidence,
            importance);
    ContextProperties properties =
        new ContextProperties(
            ContextType.SEMANTIC_CONTEXT,
            raw.source(),
            now,
            now,
            raw.contentPath(),
            ContentFormat.TEXT,
            title,
            summary,
            keywords,
            additionalMetadata);
    return new ProcessedContext(id, properties, chunks, extractedData);
  }

  /**
   * Returns the lowercase extension of the file name including the leading dot, or an empty
   * string.
   */
  public static String extensionOf(Path filePath) {
    Path fileName = filePath.getFileName();
    if (fileName == null) {
      return "";
    }
    String name = fileName.toString();
    int dot = name.lastIndexOf('.');
    return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
  }
}

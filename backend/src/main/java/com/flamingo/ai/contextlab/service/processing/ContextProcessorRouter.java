package com.flamingo.ai.contextlab.service.processing;

import com.flamingo.ai.contextlab.domain.model.ProcessedContext;
import com.flamingo.ai.contextlab.domain.model.RawContextProperties;
import com.flamingo.ai.contextlab.service.processing.code.CodeProcessor;
import com.flamingo.ai.contextlab.service.processing.excel.ExcelProcessor;
import com.flamingo.ai.contextlab.service.processing.structured.StructuredDataProcessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a raw context to the first {@link ContextProcessor} whose {@code canProcess} predicate
 * holds.
 *
 * <p>Processors are injected by Spring in {@code @Order} order (ascending), most-specific first.
 * The selected processor handles the file exclusively.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextProcessorRouter {

  private final List<ContextProcessor> processors;

  /**
   * Returns the first processor able to handle the raw context.
   *
   * @param raw raw context
   * @return selected processor, or empty when none matches
   */
  public Optional<ContextProcessor> route(RawContextProperties raw) {
    return processors.stream().filter(p -> p.canProcess(raw)).findFirst();
  }

  /**
   * Processes the raw context with the selected processor.
   *
   * <p>A non-matching file and a failing processor both yield an empty list; nothing is thrown.
   *
   * @param raw raw context
   * @return processed contexts, possibly empty
   */
  public List<ProcessedContext> dispatch(RawContextProperties raw) {
    Optional<ContextProcessor> processor = route(raw);
    if (processor.isEmpty()) {
      log.debug("No processor accepts {}", raw.contentPath());
      return List.of();
    }
    try {
      return processor.get().process(raw);
    } catch (RuntimeException e) {
      log.error(
          "Processor {} violated its no-throw contract for {}: {}",
          processor.get().getName(),
          raw.contentPath(),
          e.getMessage(),
          e);
      return List.of();
    }
  }

  /**
   * Classifies an extension into a coarse file family.
   *
   * @param extension extension with or without leading dot, any case
   * @return file family; {@link IngestFileType#UNKNOWN} when not recognized
   */
  public IngestFileType detectFileType(String extension) {
    if (extension == null || extension.isBlank()) {
      return IngestFileType.UNKNOWN;
    }
    String ext = extension.toLowerCase(Locale.ROOT);
    if (!ext.startsWith(".")) {
      ext = "." + ext;
    }
    if (ExcelProcessor.SUPPORTED_FORMATS.contains(ext)) {
      return IngestFileType.EXCEL;
    }
    if (StructuredDataProcessor.SUPPORTED_FORMATS.contains(ext)) {
      return IngestFileType.STRUCTURED_DATA;
    }
    if (CodeProcessor.SUPPORTED_FORMATS.contains(ext)) {
      return IngestFileType.CODE;
    }
    if (IngestFileType.DOCUMENT_EXTENSIONS.contains(ext)) {
      return IngestFileType.DOCUMENT;
    }
    if (IngestFileType.IMAGE_EXTENSIONS.contains(ext)) {
      return IngestFileType.IMAGE;
    }
    return IngestFileType.UNKNOWN;
  }

  /** Lists every extension handled by a registered processor, in routing order. */
  public List<SupportedFileType> getSupportedTypes() {
    List<SupportedFileType> types = new ArrayList<>();
    for (ContextProcessor processor : processors) {
      processor.getSupportedFormats().stream()
          .sorted()
          .forEach(
              ext ->
                  types.add(
                      new SupportedFileType(
                          ext, processor.getName(), processor.getDescription())));
    }
    return types;
  }
}

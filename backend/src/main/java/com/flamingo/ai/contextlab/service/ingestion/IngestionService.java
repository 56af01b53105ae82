package com.flamingo.ai.contextlab.service.ingestion;

import com.flamingo.ai.contextlab.agent.dto.GeneratedTags;
import com.flamingo.ai.contextlab.config.IngestionConfig;
import com.flamingo.ai.contextlab.domain.model.Chunk;
import com.flamingo.ai.contextlab.domain.model.ContextProperties;
import com.flamingo.ai.contextlab.domain.model.KeywordLists;
import com.flamingo.ai.contextlab.domain.model.ProcessedContext;
import com.flamingo.ai.contextlab.domain.model.RawContextProperties;
import com.flamingo.ai.contextlab.service.metadata.FileMetadataExtractor;
import com.flamingo.ai.contextlab.service.processing.AbstractContextProcessor;
import com.flamingo.ai.contextlab.service.processing.ContextProcessorRouter;
import com.flamingo.ai.contextlab.service.processing.IngestFileType;
import com.flamingo.ai.contextlab.service.tagging.AutoTaggingService;
import com.flamingo.ai.contextlab.storage.ContextStorage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ingests local files: routes each to its processor, optionally enriches the contexts with
 * generated tags, and writes them to storage.
 *
 * <p>One file's failure never stops a batch or directory run; it is reported as {@link
 * IngestionStatus#FAILED}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

  private final ContextProcessorRouter processorRouter;
  private final FileMetadataExtractor metadataExtractor;
  private final AutoTaggingService autoTaggingService;
  private final ContextStorage contextStorage;
  private final IngestionConfig ingestionConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Ingests one local file.
   *
   * @param filePath file to ingest
   * @param metadata caller metadata merged into each context's additional metadata; may be null
   * @param tags caller tags merged into each context's tags; may be null
   * @return the outcome
   */
  @Timed(value = "ingestion.file", description = "Time to ingest one file")
  public FileIngestionOutcome ingestFile(
      Path filePath, Map<String, Object> metadata, List<String> tags) {
    String fileName = filePath.getFileName() == null ? "" : filePath.getFileName().toString();
    IngestFileType fileType =
        processorRouter.detectFileType(AbstractContextProcessor.extensionOf(filePath));

    if (!Files.exists(filePath)) {
      return record(
          filePath, fileName, fileType, IngestionStatus.FAILED, List.of(), "File not found");
    }
    if (!Files.isRegularFile(filePath)) {
      return record(
          filePath, fileName, fileType, IngestionStatus.FAILED, List.of(), "Path is not a file");
    }

    log.info("Ingesting file {} (type: {})", filePath, fileType.getValue());
    Map<String, Object> rawMetadata =
        new LinkedHashMap<>(metadataExtractor.extractMetadata(filePath));
    if (metadata != null) {
      rawMetadata.putAll(metadata);
    }
    RawContextProperties raw =
        RawContextProperties.forLocalFile(
            UUID.randomUUID().toString(), filePath.toString(), rawMetadata);

    List<ProcessedContext> contexts = processorRouter.dispatch(raw);
    if (contexts.isEmpty()) {
      return record(
          filePath,
          fileName,
          fileType,
          IngestionStatus.SKIPPED,
          List.of(),
          "No processor produced contexts for this file");
    }

    List<ProcessedContext> enriched =
        contexts.stream().map(c -> enrich(c, tags)).collect(Collectors.toList());
    try {
      int stored = contextStorage.upsertContexts(enriched);
      List<String> ids = enriched.stream().map(ProcessedContext::id).collect(Collectors.toList());
      return record(
          filePath,
          fileName,
          fileType,
          IngestionStatus.PROCESSED,
          ids,
          "Stored " + stored + " context(s)");
    } catch (RuntimeException e) {
      log.error("Failed to store contexts for {}: {}", filePath, e.getMessage(), e);
      return record(
          filePath,
          fileName,
          fileType,
          IngestionStatus.FAILED,
          List.of(),
          "Storage failed: " + e.getMessage());
    }
  }

  /**
   * Ingests several files, one after another.
   *
   * @param filePaths files to ingest
   * @param metadata caller metadata for every file
   * @param tags caller tags for every file
   * @return report covering every file
   */
  public IngestionReport ingestBatch(
      List<Path> filePaths, Map<String, Object> metadata, List<String> tags) {
    List<FileIngestionOutcome> outcomes = new ArrayList<>();
    for (Path filePath : filePaths) {
      outcomes.add(ingestSafely(filePath, metadata, tags));
    }
    IngestionReport report = IngestionReport.of(outcomes, outcomes.size());
    log.info(
        "Batch ingestion completed: {} processed, {} skipped, {} failed",
        report.processed(),
        report.skipped(),
        report.failed());
    return report;
  }

  /**
   * Ingests the files of a directory.
   *
   * @param directory directory to scan
   * @param recursive whether to descend into subdirectories
   * @param filePatterns wildcards matched against file names; empty keeps all files
   * @param ignorePatterns wildcards matched against full paths; a match drops the file
   * @param metadata caller metadata for every file
   * @param tags caller tags for every file
   * @return report whose result list is capped at {@code ingestion.directory.max-reported-results}
   * @throws IllegalArgumentException when the path is not an existing directory
   */
  public IngestionReport ingestDirectory(
      Path directory,
      boolean recursive,
      List<String> filePatterns,
      List<String> ignorePatterns,
      Map<String, Object> metadata,
      List<String> tags) {
    if (!Files.exists(directory)) {
      throw new IllegalArgumentException("Directory not found: " + directory);
    }
    if (!Files.isDirectory(directory)) {
      throw new IllegalArgumentException("Path is not a directory: " + directory);
    }

    List<Pattern> includes = GlobPatterns.compile(filePatterns);
    List<Pattern> ignores = GlobPatterns.compile(ignorePatterns);
    List<Path> files;
    try (Stream<Path> walk = recursive ? Files.walk(directory) : Files.list(directory)) {
      files =
          walk.filter(Files::isRegularFile)
              .filter(
                  p ->
                      includes.isEmpty()
                          || GlobPatterns.anyMatch(includes, p.getFileName().toString()))
              .filter(p -> !GlobPatterns.anyMatch(ignores, p.toString()))
              .sorted()
              .collect(Collectors.toList());
    } catch (IOException | UncheckedIOException e) {
      throw new IllegalArgumentException("Cannot scan directory " + directory, e);
    }

    List<FileIngestionOutcome> outcomes = new ArrayList<>();
    for (Path file : files) {
      outcomes.add(ingestSafely(file, metadata, tags));
    }
    IngestionReport report =
        IngestionReport.of(outcomes, ingestionConfig.getDirectory().getMaxReportedResults());
    log.info(
        "Directory ingestion of {} completed: {} files, {} processed, {} skipped, {} failed",
        directory,
        report.totalFiles(),
        report.processed(),
        report.skipped(),
        report.failed());
    return report;
  }

  private FileIngestionOutcome ingestSafely(
      Path filePath, Map<String, Object> metadata, List<String> tags) {
    try {
      return ingestFile(filePath, metadata, tags);
    } catch (RuntimeException e) {
      log.error("Unexpected error ingesting {}: {}", filePath, e.getMessage(), e);
      String fileName = filePath.getFileName() == null ? "" : filePath.getFileName().toString();
      return record(
          filePath,
          fileName,
          IngestFileType.UNKNOWN,
          IngestionStatus.FAILED,
          List.of(),
          e.getMessage());
    }
  }

  /**
   * Merges caller tags and, when auto-tagging is enabled, generated tags into a new context.
   *
   * @param context processed context
   * @param callerTags caller tags; may be null
   * @return the enriched context, or the input when there is nothing to add
   */
  ProcessedContext enrich(ProcessedContext context, List<String> callerTags) {
    GeneratedTags generated = GeneratedTags.empty();
    if (ingestionConfig.getAutoTagging().isEnabled()) {
      String text =
          context.chunks().stream().map(Chunk::text).collect(Collectors.joining("\n\n"));
      generated = autoTaggingService.generateTags(text, context.properties().title());
    }
    if (generated.isEmpty() && (callerTags == null || callerTags.isEmpty())) {
      return context;
    }

    List<String> tags =
        KeywordLists.merge(
            context.properties().tags(),
            callerTags,
            generated.topics(),
            generated.keywords(),
            generated.categories());
    List<String> keywords =
        KeywordLists.merge(
            context.extractedData().keywords(),
            generated.topics(),
            generated.keywords(),
            generated.categories());
    List<String> entities =
        KeywordLists.merge(context.extractedData().entities(), generated.entities());

    ContextProperties properties =
        context.properties().withTagsAndMetadata(tags, context.properties().additionalMetadata());
    return new ProcessedContext(
        context.id(),
        properties,
        context.chunks(),
        context.extractedData().withKeywordsAndEntities(keywords, entities));
  }

  private FileIngestionOutcome record(
      Path filePath,
      String fileName,
      IngestFileType fileType,
      IngestionStatus status,
      List<String> contextIds,
      String message) {
    meterRegistry
        .counter("ingestion.files", "status", status.name().toLowerCase(Locale.ROOT))
        .increment();
    if (status == IngestionStatus.FAILED) {
      log.warn("Ingestion of {} failed: {}", filePath, message);
    }
    return new FileIngestionOutcome(
        filePath.toString(), fileName, fileType, status, contextIds, message);
  }
}

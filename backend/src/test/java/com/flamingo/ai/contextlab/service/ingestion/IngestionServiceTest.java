package com.flamingo.ai.contextlab.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.contextlab.agent.dto.GeneratedTags;
import com.flamingo.ai.contextlab.config.IngestionConfig;
import com.flamingo.ai.contextlab.domain.model.ProcessedContext;
import com.flamingo.ai.contextlab.exception.SearchException;
import com.flamingo.ai.contextlab.service.metadata.CodeMetadataExtractor;
import com.flamingo.ai.contextlab.service.metadata.FileMetadataExtractor;
import com.flamingo.ai.contextlab.service.processing.ContextProcessorRouter;
import com.flamingo.ai.contextlab.service.processing.IngestFileType;
import com.flamingo.ai.contextlab.service.processing.code.CodeProcessor;
import com.flamingo.ai.contextlab.service.processing.excel.ExcelProcessor;
import com.flamingo.ai.contextlab.service.processing.structured.StructuredDataProcessor;
import com.flamingo.ai.contextlab.service.tagging.AutoTaggingService;
import com.flamingo.ai.contextlab.storage.ContextStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionService Tests")
class IngestionServiceTest {

  @TempDir Path tempDir;

  @Mock private AutoTaggingService autoTaggingService;
  @Mock private ContextStorage contextStorage;

  private IngestionConfig ingestionConfig;
  private SimpleMeterRegistry meterRegistry;
  private IngestionService ingestionService;

  @BeforeEach
  void setUp() {
    ingestionConfig = new IngestionConfig();
    meterRegistry = new SimpleMeterRegistry();
    ContextProcessorRouter router =
        new ContextProcessorRouter(
            List.of(
                new ExcelProcessor(ingestionConfig, meterRegistry),
                new StructuredDataProcessor(ingestionConfig, new ObjectMapper(), meterRegistry),
                new CodeProcessor(ingestionConfig, meterRegistry)));
    ingestionService =
        new IngestionService(
            router,
            new FileMetadataExtractor(List.of(new CodeMetadataExtractor())),
            autoTaggingService,
            contextStorage,
            ingestionConfig,
            meterRegistry);
  }

  private void givenStorageAcceptsEverything() {
    when(contextStorage.upsertContexts(anyList()))
        .thenAnswer(invocation -> ((List<?>) invocation.getArgument(0)).size());
  }

  private Path write(String relative, String content) throws IOException {
    Path file = tempDir.resolve(relative);
    Files.createDirectories(file.getParent());
    return Files.writeString(file, content);
  }

  @SuppressWarnings("unchecked")
  private List<ProcessedContext> storedContexts() {
    ArgumentCaptor<List<ProcessedContext>> captor = ArgumentCaptor.forClass(List.class);
    verify(contextStorage).upsertContexts(captor.capture());
    return captor.getValue();
  }

  @Nested
  @DisplayName("Single file")
  class SingleFile {

    @Test
    @DisplayName("Should process, enrich with caller data and store a file")
    void shouldProcessAndStore() throws IOException {
      givenStorageAcceptsEverything();
      Path file = write("job.py", "import os\n\ndef run():\n    pass\n");

      FileIngestionOutcome outcome =
          ingestionService.ingestFile(file, Map.of("project", "alpha"), List.of("urgent"));

      assertThat(outcome.status()).isEqualTo(IngestionStatus.PROCESSED);
      assertThat(outcome.fileType()).isEqualTo(IngestFileType.CODE);
      assertThat(outcome.fileName()).isEqualTo("job.py");
      assertThat(outcome.contextIds()).hasSize(1);

      ProcessedContext stored = storedContexts().get(0);
      assertThat(stored.id()).isEqualTo(outcome.contextIds().get(0));
      assertThat(stored.properties().tags()).contains("urgent", "job.py");
      assertThat(stored.properties().additionalMetadata())
          .containsEntry("project", "alpha")
          .containsEntry("file_extension", ".py")
          .containsKey("code_total_lines");
      verify(autoTaggingService, never()).generateTags(anyString(), any());
      assertThat(meterRegistry.counter("ingestion.files", "status", "processed").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should merge generated tags when auto-tagging is enabled")
    void shouldMergeGeneratedTags() throws IOException {
      givenStorageAcceptsEverything();
      ingestionConfig.getAutoTagging().setEnabled(true);
      when(autoTaggingService.generateTags(anyString(), anyString()))
          .thenReturn(
              new GeneratedTags(
                  List.of("Finance"), List.of("forecast"), List.of("ACME"), List.of("report")));
      Path file = write("plan.json", "{\"year\": 2024}");

      ingestionService.ingestFile(file, null, null);

      ProcessedContext stored = storedContexts().get(0);
      assertThat(stored.properties().tags()).contains("Finance", "forecast", "report");
      assertThat(stored.extractedData().keywords()).contains("Finance", "forecast", "report");
      assertThat(stored.extractedData().entities()).containsExactly("ACME");
    }

    @Test
    @DisplayName("Should fail for a missing file or a directory")
    void shouldFailForMissingFile() {
      FileIngestionOutcome missing =
          ingestionService.ingestFile(tempDir.resolve("gone.py"), null, null);
      FileIngestionOutcome directory = ingestionService.ingestFile(tempDir, null, null);

      assertThat(missing.status()).isEqualTo(IngestionStatus.FAILED);
      assertThat(missing.message()).isEqualTo("File not found");
      assertThat(directory.status()).isEqualTo(IngestionStatus.FAILED);
      verify(contextStorage, never()).upsertContexts(anyList());
    }

    @Test
    @DisplayName("Should skip files no processor produces contexts for")
    void shouldSkipUnsupportedAndEmpty() throws IOException {
      FileIngestionOutcome text = ingestionService.ingestFile(write("a.txt", "hi"), null, null);
      FileIngestionOutcome broken =
          ingestionService.ingestFile(write("b.json", "{broken"), null, null);

      assertThat(text.status()).isEqualTo(IngestionStatus.SKIPPED);
      assertThat(text.fileType()).isEqualTo(IngestFileType.DOCUMENT);
      assertThat(broken.status()).isEqualTo(IngestionStatus.SKIPPED);
      verify(contextStorage, never()).upsertContexts(anyList());
    }

    @Test
    @DisplayName("Should report a storage failure")
    void shouldReportStorageFailure() throws IOException {
      when(contextStorage.upsertContexts(anyList())).thenThrow(new SearchException("disk full"));

      FileIngestionOutcome outcome =
          ingestionService.ingestFile(write("a.py", "x = 1"), null, null);

      assertThat(outcome.status()).isEqualTo(IngestionStatus.FAILED);
      assertThat(outcome.message()).startsWith("Storage failed");
      assertThat(outcome.contextIds()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Batches and directories")
  class BatchesAndDirectories {

    @Test
    @DisplayName("Should count every outcome of a batch")
    void shouldCountBatch() throws IOException {
      givenStorageAcceptsEverything();

      IngestionReport report =
          ingestionService.ingestBatch(
              List.of(write("a.py", "x = 1"), write("b.txt", "hi"), tempDir.resolve("c.py")),
              null,
              null);

      assertThat(report.totalFiles()).isEqualTo(3);
      assertThat(report.processed()).isEqualTo(1);
      assertThat(report.skipped()).isEqualTo(1);
      assertThat(report.failed()).isEqualTo(1);
      assertThat(report.results()).hasSize(3);
    }

    @Test
    @DisplayName("Should walk a directory with include and ignore patterns")
    void shouldWalkDirectory() throws IOException {
      givenStorageAcceptsEverything();
      write("a.py", "x = 1");
      write("sub/b.json", "{\"k\": 1}");
      write("node_modules/lib/c.js", "function c() {}");
      write("notes.txt", "hi");

      IngestionReport report =
          ingestionService.ingestDirectory(
              tempDir,
              true,
              List.of("*.py", "*.json", "*.js"),
              List.of("*node_modules*"),
              null,
              null);

      assertThat(report.totalFiles()).isEqualTo(2);
      assertThat(report.processed()).isEqualTo(2);
      assertThat(report.results())
          .extracting(FileIngestionOutcome::fileName)
          .containsExactly("a.py", "b.json");
    }

    @Test
    @DisplayName("Should stay in the top directory unless recursive")
    void shouldHonorRecursiveFlag() throws IOException {
      givenStorageAcceptsEverything();
      write("a.py", "x = 1");
      write("sub/b.py", "y = 2");

      IngestionReport report =
          ingestionService.ingestDirectory(tempDir, false, List.of(), List.of(), null, null);

      assertThat(report.results())
          .extracting(FileIngestionOutcome::fileName)
          .containsExactly("a.py");
    }

    @Test
    @DisplayName("Should cap reported results but count every file")
    void shouldCapReportedResults() throws IOException {
      givenStorageAcceptsEverything();
      ingestionConfig.getDirectory().setMaxReportedResults(1);
      write("a.py", "x = 1");
      write("b.py", "y = 2");

      IngestionReport report =
          ingestionService.ingestDirectory(tempDir, true, null, null, null, null);

      assertThat(report.totalFiles()).isEqualTo(2);
      assertThat(report.processed()).isEqualTo(2);
      assertThat(report.results()).hasSize(1);
    }

    @Test
    @DisplayName("Should reject a missing directory or a file path")
    void shouldRejectInvalidDirectory() throws IOException {
      Path file = write("a.py", "x = 1");

      assertThatThrownBy(
              () ->
                  ingestionService.ingestDirectory(
                      tempDir.resolve("nope"), true, null, null, null, null))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("not found");
      assertThatThrownBy(
              () -> ingestionService.ingestDirectory(file, true, null, null, null, null))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("not a directory");
    }
  }
}

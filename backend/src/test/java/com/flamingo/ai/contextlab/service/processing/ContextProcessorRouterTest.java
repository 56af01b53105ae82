package com.flamingo.ai.contextlab.service.processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.contextlab.config.IngestionConfig;
import com.flamingo.ai.contextlab.domain.model.ProcessedContext;
import com.flamingo.ai.contextlab.domain.model.RawContextProperties;
import com.flamingo.ai.contextlab.service.processing.code.CodeProcessor;
import com.flamingo.ai.contextlab.service.processing.excel.ExcelProcessor;
import com.flamingo.ai.contextlab.service.processing.structured.StructuredDataProcessor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ContextProcessorRouter Tests")
class ContextProcessorRouterTest {

  @TempDir Path tempDir;

  private ContextProcessorRouter router;

  @BeforeEach
  void setUp() {
    IngestionConfig config = new IngestionConfig();
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    router =
        new ContextProcessorRouter(
            List.of(
                new ExcelProcessor(config, registry),
                new StructuredDataProcessor(config, new ObjectMapper(), registry),
                new CodeProcessor(config, registry)));
  }

  private static RawContextProperties raw(Path file) {
    return RawContextProperties.forLocalFile("r-1", file.toString(), Map.of());
  }

  @Nested
  @DisplayName("Routing")
  class Routing {

    @Test
    @DisplayName("Should route each file to the processor owning its extension")
    void shouldRouteByExtension() throws IOException {
      Path json = Files.writeString(tempDir.resolve("data.json"), "{}");
      Path code = Files.writeString(tempDir.resolve("main.py"), "print(1)");

      assertThat(router.route(raw(json)))
          .get()
          .extracting(ContextProcessor::getName)
          .isEqualTo(StructuredDataProcessor.NAME);
      assertThat(router.route(raw(code)))
          .get()
          .extracting(ContextProcessor::getName)
          .isEqualTo(CodeProcessor.NAME);
    }

    @Test
    @DisplayName("Should return empty for unsupported files")
    void shouldReturnEmptyForUnsupported() throws IOException {
      Path text = Files.writeString(tempDir.resolve("notes.txt"), "hello");

      assertThat(router.route(raw(text))).isEmpty();
      assertThat(router.dispatch(raw(text))).isEmpty();
    }

    @Test
    @DisplayName("Should prefer the first matching processor")
    void shouldPreferFirstMatch() throws IOException {
      Path file = Files.writeString(tempDir.resolve("x.py"), "print(1)");
      ContextProcessor first = mock(ContextProcessor.class);
      when(first.canProcess(any())).thenReturn(true);
      when(first.getName()).thenReturn("first");
      ContextProcessorRouter ordered =
          new ContextProcessorRouter(
              List.of(first, new CodeProcessor(new IngestionConfig(), new SimpleMeterRegistry())));

      assertThat(ordered.route(raw(file)))
          .get()
          .extracting(ContextProcessor::getName)
          .isEqualTo("first");
    }

    @Test
    @DisplayName("Should contain a processor that throws")
    void shouldContainThrowingProcessor() throws IOException {
      Path file = Files.writeString(tempDir.resolve("x.py"), "print(1)");
      ContextProcessor broken = mock(ContextProcessor.class);
      when(broken.canProcess(any())).thenReturn(true);
      when(broken.getName()).thenReturn("broken");
      when(broken.process(any())).thenThrow(new IllegalStateException("boom"));

      List<ProcessedContext> result =
          new ContextProcessorRouter(List.of(broken)).dispatch(raw(file));

      assertThat(result).isEmpty();
    }

    @Test
    @DisplayName("Should process through the selected processor")
    void shouldDispatch() throws IOException {
      Path code = Files.writeString(tempDir.resolve("main.py"), "def run():\n  pass\n");

      List<ProcessedContext> contexts = router.dispatch(raw(code));

      assertThat(contexts).hasSize(1);
      assertThat(contexts.get(0).properties().additionalMetadata())
          .containsEntry("processor", CodeProcessor.NAME);
    }
  }

  @Nested
  @DisplayName("File type detection")
  class FileTypeDetection {

    @Test
    @DisplayName("Should classify extensions with or without a dot in any case")
    void shouldClassifyExtensions() {
      assertThat(router.detectFileType(".XLSX")).isEqualTo(IngestFileType.EXCEL);
      assertThat(router.detectFileType("yml")).isEqualTo(IngestFileType.STRUCTURED_DATA);
      assertThat(router.detectFileType(".kt")).isEqualTo(IngestFileType.CODE);
      assertThat(router.detectFileType(".pdf")).isEqualTo(IngestFileType.DOCUMENT);
      assertThat(router.detectFileType("jpeg")).isEqualTo(IngestFileType.IMAGE);
      assertThat(router.detectFileType(".zip")).isEqualTo(IngestFileType.UNKNOWN);
      assertThat(router.detectFileType("")).isEqualTo(IngestFileType.UNKNOWN);
    }

    @Test
    @DisplayName("Should list supported types in routing order")
    void shouldListSupportedTypes() {
      List<SupportedFileType> types = router.getSupportedTypes();

      assertThat(types.get(0).extension()).isEqualTo(".xls");
      assertThat(types.get(0).processor()).isEqualTo(ExcelProcessor.NAME);
      assertThat(types)
          .extracting(SupportedFileType::extension)
          .containsAll(Set.of(".json", ".jsonl", ".py", ".rs"));
      assertThat(types).hasSize(2 + 4 + CodeProcessor.SUPPORTED_FORMATS.size());
    }
  }
}

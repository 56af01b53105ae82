package com.flamingo.ai.contextlab.service.processing.code;

import com.flamingo.ai.contextlab.config.IngestionConfig;
import com.flamingo.ai.contextlab.domain.model.Chunk;
import com.flamingo.ai.contextlab.domain.model.ProcessedContext;
import com.flamingo.ai.contextlab.domain.model.RawContextProperties;
import com.flamingo.ai.contextlab.service.processing.AbstractContextProcessor;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Processor for source code files with syntax-aware chunking.
 *
 * <p>The language is inferred from the file extension alone. For languages with a {@link
 * LanguagePatterns} entry, every function, class and struct definition starts a chunk that runs
 * to the next definition. Other languages, and files where no definition matches, are cut into
 * fixed-size line windows.
 *
 * <p>Definition detection is regex based and therefore approximate: multi-line signatures,
 * decorators and nested scopes are not understood. The line-window fallback keeps output
 * predictable when the heuristic finds nothing.
 */
@Service
@Order(30)
@Slf4j
public class CodeProcessor extends AbstractContextProcessor {

  public static final String NAME = "code_processor";

  /** Extension to language, in registration order. */
  public static final Map<String, String> EXTENSION_TO_LANGUAGE = extensionTable();

  public static final Set<String> SUPPORTED_FORMATS = Set.copyOf(EXTENSION_TO_LANGUAGE.keySet());

  static final String UNKNOWN_LANGUAGE = "unknown";

  private static final int PREVIEW_LINES = 20;
  private static final int MAX_IMPORTS = 20;
  private static final int MAX_KEYWORD_NAMES = 10;
  private static final int MAX_ENTITIES = 20;

  private final IngestionConfig.Code config;

  public CodeProcessor(IngestionConfig ingestionConfig, MeterRegistry meterRegistry) {
    super(meterRegistry);
    this.config = ingestionConfig.getCode();
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public String getDescription() {
    return "Source code processing with syntax awareness";
  }

  @Override
  public Set<String> getSupportedFormats() {
    return SUPPORTED_FORMATS;
  }

  @Override
  protected boolean isEnabled() {
    return config.isEnabled();
  }

  @Override
  protected List<ProcessedContext> doProcess(RawContextProperties raw, Path filePath)
      throws IOException {
    String code = readLenient(filePath);
    String fileName = filePath.getFileName().toString();
    String language = detectLanguage(filePath);

    List<String> lines = splitLines(code);
    LanguagePatterns patterns = LanguagePatterns.forLanguage(language);
    Optional<List<String>> functions =
        declaredNames(patterns, LanguagePatterns::function, config.isExtractFunctions(), lines);
    Optional<List<String>> classes =
        declaredNames(patterns, LanguagePatterns::classDef, config.isExtractClasses(), lines);

    Map<String, Object> metadata =
        extractCodeMetadata(lines, language, filePath, functions, classes);
    List<Chunk> chunks = createChunks(code, language, fileName);
    if (chunks.isEmpty()) {
      return List.of();
    }
    return List.of(
        createContext(
            raw,
            chunks,
            metadata,
            language,
            fileName,
            functions.orElse(List.of()),
            classes.orElse(List.of())));
  }

  /** Names matched by one pattern; empty when extraction is off or the language lacks it. */
  private static Optional<List<String>> declaredNames(
      LanguagePatterns patterns,
      Function<LanguagePatterns, Pattern> selector,
      boolean enabled,
      List<String> lines) {
    if (!enabled || patterns == null || selector.apply(patterns) == null) {
      return Optional.empty();
    }
    return Optional.of(patterns.findAll(selector.apply(patterns), lines));
  }

  /** Detects the language from the file extension; {@code unknown} when not in the table. */
  public String detectLanguage(Path filePath) {
    return EXTENSION_TO_LANGUAGE.getOrDefault(extensionOf(filePath), UNKNOWN_LANGUAGE);
  }

  Map<String, Object> extractCodeMetadata(
      List<String> lines,
      String language,
      Path filePath,
      Optional<List<String>> functions,
      Optional<List<String>> classes) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("file_name", filePath.getFileName().toString());
    metadata.put("file_path", filePath.toString());
    metadata.put("language", language);
    metadata.put("total_lines", lines.size());
    metadata.put("non_empty_lines", lines.stream().filter(l -> !l.isBlank()).count());

    LanguagePatterns patterns = LanguagePatterns.forLanguage(language);
    if (patterns == null) {
      return metadata;
    }

    functions.ifPresent(
        names -> {
          metadata.put("functions", names);
          metadata.put("num_functions", names.size());
        });
    classes.ifPresent(
        names -> {
          metadata.put("classes", names);
          metadata.put("num_classes", names.size());
        });
    if (config.isExtractImports() && patterns.importStmt() != null) {
      List<String> imports = patterns.findAll(patterns.importStmt(), lines);
      metadata.put(
          "imports", List.copyOf(imports.subList(0, Math.min(MAX_IMPORTS, imports.size()))));
      metadata.put("num_imports", imports.size());
    }
    return metadata;
  }

  List<Chunk> createChunks(String code, String language, String fileName) {
    List<String> lines = splitLines(code);
    List<Chunk> chunks = new ArrayList<>();

    int previewLines = Math.min(PREVIEW_LINES, lines.size());
    StringBuilder overview = new StringBuilder();
    overview.append("Code File: ").append(fileName).append('\n');
    overview.append("Language: ").append(language).append('\n');
    overview.append("Total Lines: ").append(lines.size()).append('\n');
    overview.append("\nFirst ").append(previewLines).append(" lines:\n");
    overview.append(String.join("\n", lines.subList(0, previewLines)));
    chunks.add(new Chunk(overview.toString(), 0, List.of(fileName, language, "code", "overview")));

    LanguagePatterns patterns = LanguagePatterns.forLanguage(language);
    List<Chunk> bodyChunks =
        patterns != null
            ? chunkBySyntax(lines, patterns, language, fileName, chunks.size())
            : List.of();
    if (bodyChunks.isEmpty()) {
      bodyChunks = chunkByLines(lines, fileName, chunks.size());
    }
    chunks.addAll(bodyChunks);
    return chunks;
  }

  private List<Chunk> chunkBySyntax(
      List<String> lines,
      LanguagePatterns patterns,
      String language,
      String fileName,
      int startIndex) {
    List<CodeElement> elements = patterns.scanElements(lines);

    List<Chunk> chunks = new ArrayList<>();
    for (int i = 0; i < elements.size(); i++) {
      CodeElement element = elements.get(i);
      int startLine = element.line();
      int endLine = i + 1 < elements.size() ? elements.get(i + 1).line() : lines.size();

      String text =
          capitalize(element.type())
              + ": "
              + element.name()
              + "\nLines "
              + (startLine + 1)
              + "-"
              + endLine
              + "\n\n"
              + String.join("\n", lines.subList(startLine, endLine));
      chunks.add(
          new Chunk(
              text,
              startIndex + chunks.size(),
              List.of(fileName, language, element.type(), element.name()),
              List.of(element.name())));
    }
    return chunks;
  }

  private List<Chunk> chunkByLines(List<String> lines, String fileName, int startIndex) {
    int window = Math.max(1, config.getMaxLinesPerChunk());
    List<Chunk> chunks = new ArrayList<>();
    for (int i = 0; i < lines.size(); i += window) {
      List<String> windowLines = lines.subList(i, Math.min(i + window, lines.size()));
      int first = i + 1;
      int last = i + windowLines.size();
      String text = "Lines " + first + "-" + last + "\n\n" + String.join("\n", windowLines);
      chunks.add(
          new Chunk(
              text, startIndex + chunks.size(), List.of(fileName, "lines_" + first + "_" + last)));
    }
    return chunks;
  }

  private ProcessedContext createContext(
      RawContextProperties raw,
      List<Chunk> chunks,
      Map<String, Object> metadata,
      String language,
      String fileName,
      List<String> functions,
      List<String> classes) {
    StringBuilder summary =
        new StringBuilder(capitalize(language))
            .append(" code with ")
            .append(metadata.get("total_lines"))
            .append(" lines");
    if (metadata.containsKey("num_functions")) {
      summary.append(", ").append(metadata.get("num_functions")).append(" functions");
    }
    if (metadata.containsKey("num_classes")) {
      summary.append(", ").append(metadata.get("num_classes")).append(" classes");
    }

    List<String> keywords = new ArrayList<>(List.of(fileName, language, "code"));
    keywords.addAll(functions.subList(0, Math.min(MAX_KEYWORD_NAMES, functions.size())));
    keywords.addAll(classes.subList(0, Math.min(MAX_KEYWORD_NAMES, classes.size())));

    List<String> entities = new ArrayList<>(functions);
    entities.addAll(classes);
    if (entities.size() > MAX_ENTITIES) {
      entities = entities.subList(0, MAX_ENTITIES);
    }

    return buildContext(
        raw.objectId(),
        raw,
        chunks,
        fileName,
        summary.toString(),
        keywords,
        entities,
        metadata,
        90,
        80);
  }

  /** Reads UTF-8 text, silently dropping undecodable bytes. */
  static String readLenient(Path filePath) throws IOException {
    byte[] bytes = Files.readAllBytes(filePath);
    return StandardCharsets.UTF_8
        .newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE)
        .decode(ByteBuffer.wrap(bytes))
        .toString();
  }

  /** Splits on line breaks, normalizing CRLF and CR; a trailing newline yields a final "" line. */
  static List<String> splitLines(String code) {
    String normalized = code.replace("\r\n", "\n").replace('\r', '\n');
    return List.of(normalized.split("\n", -1));
  }

  private static String capitalize(String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    return Character.toUpperCase(value.charAt(0)) + value.substring(1).toLowerCase();
  }

  private static Map<String, String> extensionTable() {
    Map<String, String> table = new LinkedHashMap<>();
    table.put(".py", "python");
    table.put(".js", "javascript");
    table.put(".jsx", "javascript");
    table.put(".ts", "javascript");
    table.put(".tsx", "javascript");
    table.put(".java", "java");
    table.put(".go", "go");
    table.put(".c", "c");
    table.put(".cpp", "cpp");
    table.put(".h", "c");
    table.put(".hpp", "cpp");
    table.put(".cs", "csharp");
    table.put(".rb", "ruby");
    table.put(".php", "php");
    table.put(".swift", "swift");
    table.put(".kt", "kotlin");
    table.put(".rs", "rust");
    return Collections.unmodifiableMap(table);
  }
}

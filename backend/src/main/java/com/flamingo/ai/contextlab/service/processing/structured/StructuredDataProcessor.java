package com.flamingo.ai.contextlab.service.processing.structured;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.flamingo.ai.contextlab.config.IngestionConfig;
import com.flamingo.ai.contextlab.domain.model.Chunk;
import com.flamingo.ai.contextlab.domain.model.ProcessedContext;
import com.flamingo.ai.contextlab.domain.model.RawContextProperties;
import com.flamingo.ai.contextlab.exception.ContextProcessingException;
import com.flamingo.ai.contextlab.service.processing.AbstractContextProcessor;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Processor for JSON, JSONL and YAML files.
 *
 * <p>Documents are read into a Jackson tree; YAML is never bound to arbitrary types. The first
 * chunk is an overview with a truncated preview, followed by one chunk per top-level key for
 * objects or one chunk per batch of items for arrays.
 */
@Service
@Order(20)
@Slf4j
public class StructuredDataProcessor extends AbstractContextProcessor {

  public static final String NAME = "structured_data_processor";

  public static final Set<String> SUPPORTED_FORMATS = Set.of(".json", ".yaml", ".yml", ".jsonl");

  static final String TRUNCATION_SUFFIX = "\n... (truncated)";

  private static final int MAX_OVERVIEW_KEYS = 10;
  private static final int PREVIEW_LENGTH = 500;
  private static final int CONTENT_LENGTH = 2000;

  private final IngestionConfig.StructuredData config;
  private final ObjectMapper jsonMapper;
  private final YAMLMapper yamlMapper = new YAMLMapper();
  private final ObjectWriter prettyWriter;

  public StructuredDataProcessor(
      IngestionConfig ingestionConfig, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
    super(meterRegistry);
    this.config = ingestionConfig.getStructuredData();
    this.jsonMapper = objectMapper;
    this.prettyWriter = objectMapper.writer(prettyPrinter());
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public String getDescription() {
    return "Processor for JSON and YAML files with structure preservation";
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
  protected List<ProcessedContext> doProcess(RawContextProperties raw, Path filePath) {
    JsonNode data = load(raw, filePath);
    if (data == null || data.isNull() || data.isMissingNode()) {
      log.warn("No structured data found in {}", filePath);
      return List.of();
    }

    String fileName = filePath.getFileName().toString();
    Map<String, Object> metadata = extractMetadata(data, filePath);
    List<Chunk> chunks = createChunks(data, fileName);
    return List.of(createContext(raw, chunks, data, filePath, metadata));
  }

  private JsonNode load(RawContextProperties raw, Path filePath) {
    String extension = extensionOf(filePath);
    try {
      String content = Files.readString(filePath, StandardCharsets.UTF_8);
      if (extension.equals(".jsonl")) {
        ArrayNode items = jsonMapper.createArrayNode();
        for (String line : content.split("\\R")) {
          if (!line.isBlank()) {
            items.add(jsonMapper.readTree(line));
          }
        }
        return items;
      }
      if (extension.equals(".yaml") || extension.equals(".yml")) {
        return yamlMapper.readTree(content);
      }
      return jsonMapper.readTree(content);
    } catch (IOException e) {
      throw new ContextProcessingException(
          raw.objectId(), raw.contentPath(), "Failed to load " + extension + " file", e);
    }
  }

  Map<String, Object> extractMetadata(JsonNode data, Path filePath) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("file_name", filePath.getFileName().toString());
    metadata.put("file_path", filePath.toString());
    metadata.put("file_type", extensionOf(filePath));
    metadata.put("data_type", typeName(data));

    if (data.isObject()) {
      List<String> keys = fieldNames(data);
      metadata.put("top_level_keys", keys);
      metadata.put("num_keys", keys.size());
    } else if (data.isArray()) {
      metadata.put("num_items", data.size());
      if (data.size() > 0 && data.get(0).isObject()) {
        metadata.put("item_keys", fieldNames(data.get(0)));
      }
    }
    metadata.put("schema", extractSchema(data, 0));
    return metadata;
  }

  /** Infers a JSON-schema-like description; the first element of an array stands for all. */
  Map<String, Object> extractSchema(JsonNode data, int depth) {
    Map<String, Object> schema = new LinkedHashMap<>();
    if (depth > config.getMaxDepth()) {
      schema.put("type", "max_depth_exceeded");
      return schema;
    }
    if (data.isObject()) {
      Map<String, Object> properties = new LinkedHashMap<>();
      data.fields()
          .forEachRemaining(
              e -> properties.put(e.getKey(), extractSchema(e.getValue(), depth + 1)));
      schema.put("type", "object");
      schema.put("properties", properties);
    } else if (data.isArray()) {
      schema.put("type", "array");
      if (data.isEmpty()) {
        schema.put("items", Map.of());
      } else {
        schema.put("length", data.size());
        schema.put("items", extractSchema(data.get(0), depth + 1));
      }
    } else {
      schema.put("type", typeName(data));
    }
    return schema;
  }

  List<Chunk> createChunks(JsonNode data, String fileName) {
    List<Chunk> chunks = new ArrayList<>();

    StringBuilder overview = new StringBuilder();
    overview.append("File: ").append(fileName).append('\n');
    overview.append("Type: ").append(typeName(data)).append('\n');
    if (data.isObject()) {
      List<String> keys = fieldNames(data);
      overview
          .append("Top-level keys: ")
          .append(String.join(", ", keys.subList(0, Math.min(MAX_OVERVIEW_KEYS, keys.size()))))
          .append('\n');
      if (keys.size() > MAX_OVERVIEW_KEYS) {
        overview.append("... and ").append(keys.size() - MAX_OVERVIEW_KEYS).append(" more keys\n");
      }
    } else if (data.isArray()) {
      overview.append("Array with ").append(data.size()).append(" items\n");
    }
    overview.append("\nPreview:\n").append(pretty(data, PREVIEW_LENGTH)).append('\n');
    chunks.add(new Chunk(overview.toString(), 0, List.of(fileName, "overview", "structure")));

    if (data.isObject()) {
      chunkObject(data, fileName, chunks);
    } else if (data.isArray()) {
      chunkArray(data, fileName, chunks);
    }
    return chunks;
  }

  private void chunkObject(JsonNode data, String fileName, List<Chunk> chunks) {
    Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      String key = field.getKey();
      JsonNode value = field.getValue();

      if (value.isContainerNode()) {
        String text =
            "Path: "
                + key
                + "\nType: "
                + typeName(value)
                + "\nContent:\n"
                + pretty(value, CONTENT_LENGTH)
                + "\n";
        chunks.add(new Chunk(text, chunks.size(), List.of(fileName, key, key, typeName(value))));
      } else {
        String text = "Path: " + key + "\nValue: " + scalarText(value) + "\n";
        chunks.add(new Chunk(text, chunks.size(), List.of(fileName, key, key)));
      }
    }
  }

  private void chunkArray(JsonNode data, String fileName, List<Chunk> chunks) {
    int batchSize = Math.max(1, config.getMaxArrayItemsPerChunk());
    for (int i = 0; i < data.size(); i += batchSize) {
      int end = Math.min(i + batchSize, data.size());
      ArrayNode batch = jsonMapper.createArrayNode();
      for (int j = i; j < end; j++) {
        batch.add(data.get(j));
      }
      String text =
          "Path: \nArray items ["
              + i
              + ":"
              + end
              + "]\nContent:\n"
              + pretty(batch, CONTENT_LENGTH)
              + "\n";
      chunks.add(
          new Chunk(text, chunks.size(), List.of(fileName, "array", "items_" + i + "_" + end)));
    }
  }

  private ProcessedContext createContext(
      RawContextProperties raw,
      List<Chunk> chunks,
      JsonNode data,
      Path filePath,
      Map<String, Object> metadata) {
    String fileName = filePath.getFileName().toString();
    String dataType = typeName(data);
    List<String> keys = data.isObject() ? fieldNames(data) : List.of();

    String summary;
    if (data.isObject()) {
      summary = "Structured data with " + keys.size() + " top-level keys";
    } else if (data.isArray()) {
      summary = "Array with " + data.size() + " items";
    } else {
      summary = "Structured data of type " + dataType;
    }

    List<String> keywords = new ArrayList<>();
    keywords.add(fileName);
    keywords.add(extensionOf(filePath).replaceFirst("^\\.", ""));
    keywords.add(dataType);
    keywords.addAll(keys.subList(0, Math.min(MAX_OVERVIEW_KEYS, keys.size())));

    return buildContext(
        raw.objectId(), raw, chunks, fileName, summary, keywords, List.of(), metadata, 95, 75);
  }

  private String pretty(JsonNode node, int maxLength) {
    String text;
    try {
      text = prettyWriter.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      log.warn("Could not serialize node for preview: {}", e.getMessage());
      text = node.toString();
    }
    return text.length() > maxLength ? text.substring(0, maxLength) + TRUNCATION_SUFFIX : text;
  }

  static String typeName(JsonNode node) {
    if (node.isObject()) {
      return "object";
    }
    if (node.isArray()) {
      return "array";
    }
    if (node.isTextual()) {
      return "string";
    }
    if (node.isIntegralNumber()) {
      return "integer";
    }
    if (node.isNumber()) {
      return "number";
    }
    if (node.isBoolean()) {
      return "boolean";
    }
    if (node.isNull()) {
      return "null";
    }
    return "string";
  }

  private static String scalarText(JsonNode value) {
    return value.isTextual() ? value.textValue() : value.toString();
  }

  private static List<String> fieldNames(JsonNode node) {
    List<String> names = new ArrayList<>();
    node.fieldNames().forEachRemaining(names::add);
    return names;
  }

  /** Two-space indentation with {@code "key": value} spacing. */
  static DefaultPrettyPrinter prettyPrinter() {
    DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
    Separators separators =
        Separators.createDefaultInstance()
            .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
            .withObjectEmptySeparator("")
            .withArrayEmptySeparator("");
    DefaultPrettyPrinter printer = new DefaultPrettyPrinter().withSeparators(separators);
    printer.indentObjectsWith(indenter);
    printer.indentArraysWith(indenter);
    return printer;
  }
}

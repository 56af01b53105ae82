package com.flamingo.ai.contextlab.service.tagging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flamingo.ai.contextlab.agent.TagExtractionAgent;
import com.flamingo.ai.contextlab.agent.dto.GeneratedTags;
import com.flamingo.ai.contextlab.config.AsyncConfig;
import com.flamingo.ai.contextlab.config.IngestionConfig;
import com.flamingo.ai.contextlab.domain.model.KeywordLists;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Generates topics, keywords, entities and categories for content with the {@link
 * TagExtractionAgent}.
 *
 * <p>Never throws: an empty reply, unparseable JSON or any model failure yields {@link
 * GeneratedTags#empty()}.
 */
@Service
@Slf4j
public class AutoTaggingService {

  static final int MAX_TAGS_PER_LIST = 10;
  static final int MAX_TAG_LENGTH = 100;
  private static final int MAX_PATH_TAGS = 5;

  private static final Pattern CODE_FENCE = Pattern.compile("(?m)^\\s*```[\\w-]*\\s*$");

  private static final JsonMapper LENIENT_MAPPER =
      JsonMapper.builder()
          .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
          .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
          .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
          .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
          .build();

  private final TagExtractionAgent tagExtractionAgent;
  private final IngestionConfig.AutoTagging config;
  private final MeterRegistry meterRegistry;
  private final Executor autoTaggingExecutor;

  public AutoTaggingService(
      TagExtractionAgent tagExtractionAgent,
      IngestionConfig ingestionConfig,
      MeterRegistry meterRegistry,
      @Qualifier("autoTaggingExecutor") Executor autoTaggingExecutor) {
    this.tagExtractionAgent = tagExtractionAgent;
    this.config = ingestionConfig.getAutoTagging();
    this.meterRegistry = meterRegistry;
    this.autoTaggingExecutor = autoTaggingExecutor;
  }

  /**
   * Generates tags on the shared auto-tagging executor.
   *
   * @param content content to analyze
   * @param title optional title prepended to the content
   * @return future completing with the cleaned tags; never completes exceptionally
   */
  public CompletableFuture<GeneratedTags> generateTagsAsync(String content, String title) {
    try {
      return CompletableFuture.supplyAsync(() -> doGenerate(content, title), autoTaggingExecutor);
    } catch (RejectedExecutionException e) {
      log.error("Auto-tagging executor rejected the task: {}", e.getMessage());
      meterRegistry.counter("auto_tagging.failure", "reason", "rejected").increment();
      return CompletableFuture.completedFuture(GeneratedTags.empty());
    }
  }

  /**
   * Generates tags and waits for the result on a dedicated single-thread executor that lives only
   * for this call.
   *
   * <p>Must not be called from an auto-tagging executor thread; such calls return empty tags.
   *
   * @param content content to analyze
   * @param title optional title prepended to the content
   * @return cleaned tags
   */
  public GeneratedTags generateTags(String content, String title) {
    if (Thread.currentThread().getName().startsWith(AsyncConfig.AUTO_TAGGING_THREAD_PREFIX)) {
      log.error(
          "Blocking tag generation called from auto-tagging thread {}; use generateTagsAsync",
          Thread.currentThread().getName());
      meterRegistry.counter("auto_tagging.failure", "reason", "nested").increment();
      return GeneratedTags.empty();
    }

    ExecutorService executor =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "tagging-call");
              thread.setDaemon(true);
              return thread;
            });
    Future<GeneratedTags> future = executor.submit(() -> doGenerate(content, title));
    try {
      return future.get(config.getBlockingTimeoutSeconds(), TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.error("Tag generation timed out after {}s", config.getBlockingTimeoutSeconds());
      meterRegistry.counter("auto_tagging.failure", "reason", "timeout").increment();
      return GeneratedTags.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      log.warn("Interrupted while waiting for tag generation");
      return GeneratedTags.empty();
    } catch (ExecutionException e) {
      log.error("Error in synchronous tag generation: {}", e.getMessage(), e);
      return GeneratedTags.empty();
    } finally {
      executor.shutdownNow();
    }
  }

  private GeneratedTags doGenerate(String content, String title) {
    try {
      String response = tagExtractionAgent.extractTags(prepareContent(content, title));
      if (response == null || response.isBlank()) {
        log.warn("Empty response from LLM for tag generation");
        meterRegistry.counter("auto_tagging.failure", "reason", "empty").increment();
        return GeneratedTags.empty();
      }

      Optional<JsonNode> parsed = parseLenient(response);
      if (parsed.isEmpty()) {
        log.warn("Failed to parse JSON from LLM response");
        meterRegistry.counter("auto_tagging.failure", "reason", "parse").increment();
        return GeneratedTags.empty();
      }

      JsonNode json = parsed.get();
      GeneratedTags tags =
          new GeneratedTags(
              cleanTags(json.get("topics")),
              cleanTags(json.get("keywords")),
              cleanTags(json.get("entities")),
              cleanTags(json.get("categories")));
      meterRegistry.counter("auto_tagging.success").increment();
      log.info(
          "Generated tags: {} topics, {} keywords, {} entities, {} categories",
          tags.topics().size(),
          tags.keywords().size(),
          tags.entities().size(),
          tags.categories().size());
      return tags;
    } catch (RuntimeException e) {
      log.error("Error generating tags: {}", e.getMessage(), e);
      meterRegistry.counter("auto_tagging.failure", "reason", "error").increment();
      return GeneratedTags.empty();
    }
  }

  /** Truncates the content and prepends the title when one is given. */
  String prepareContent(String content, String title) {
    String text = content == null ? "" : content;
    if (text.length() > config.getMaxContentLength()) {
      text = text.substring(0, config.getMaxContentLength()) + "...";
    }
    if (title != null && !title.isBlank()) {
      text = "Title: " + title + "\n\n" + text;
    }
    return text;
  }

  /**
   * Parses the outermost JSON object of a model reply, tolerating code fences, single quotes,
   * trailing commas, comments and unquoted field names.
   *
   * @param response raw model reply
   * @return the parsed object, or empty when none can be read
   */
  static Optional<JsonNode> parseLenient(String response) {
    String text = CODE_FENCE.matcher(response).replaceAll("");
    int start = text.indexOf('{');
    int end = text.lastIndexOf('}');
    if (start < 0 || end <= start) {
      return Optional.empty();
    }
    try {
      JsonNode node = LENIENT_MAPPER.readTree(text.substring(start, end + 1));
      return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
    } catch (JsonProcessingException e) {
      log.debug("Lenient JSON parse failed: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }

  private static List<String> cleanTags(JsonNode node) {
    if (node == null || !node.isArray()) {
      return List.of();
    }
    List<Object> values = new ArrayList<>();
    for (JsonNode element : node) {
      if (element.isTextual()) {
        values.add(element.textValue());
      } else if (element.isNumber() || element.isBoolean()) {
        values.add(element.asText());
      }
    }
    return cleanTags(values);
  }

  /**
   * Cleans one tag list: strings, numbers and booleans become trimmed strings; empty or overlong
   * entries are dropped; duplicates are removed case-insensitively keeping the first spelling; at
   * most {@value #MAX_TAGS_PER_LIST} entries remain. Applying it twice changes nothing.
   *
   * @param values raw values; other element types are ignored
   * @return cleaned tags
   */
  public static List<String> cleanTags(List<?> values) {
    if (values == null) {
      return List.of();
    }
    List<String> cleaned = new ArrayList<>();
    for (Object value : values) {
      if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
        continue;
      }
      String tag = value.toString().strip();
      if (!tag.isEmpty() && tag.length() < MAX_TAG_LENGTH) {
        cleaned.add(tag);
      }
    }
    List<String> unique = KeywordLists.distinct(cleaned);
    return unique.size() > MAX_TAGS_PER_LIST ? unique.subList(0, MAX_TAGS_PER_LIST) : unique;
  }

  /**
   * Derives basic tags from a path: the file stem, the extension without dot, then parent directory
   * names from nearest to farthest, stopping at five tags.
   *
   * @param filePath file path
   * @return path-derived tags
   */
  public List<String> extractTagsFromFilePath(String filePath) {
    Path path = Path.of(filePath);
    List<String> tags = new ArrayList<>();
    Path fileName = path.getFileName();
    if (fileName == null) {
      return tags;
    }
    String name = fileName.toString();
    int dot = name.lastIndexOf('.');
    if (dot > 0) {
      tags.add(name.substring(0, dot));
      tags.add(name.substring(dot + 1));
    } else {
      tags.add(name);
    }

    for (Path parent = path.getParent();
        parent != null && tags.size() < MAX_PATH_TAGS;
        parent = parent.getParent()) {
      Path parentName = parent.getFileName();
      if (parentName != null && !parentName.toString().isEmpty()) {
        String dirName = parentName.toString();
        if (!dirName.equals(".") && !dirName.equals("..")) {
          tags.add(dirName);
        }
      }
    }
    return tags;
  }
}

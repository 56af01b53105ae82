package com.flamingo.ai.contextlab.storage;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import com.flamingo.ai.contextlab.domain.enums.ContextType;
import com.flamingo.ai.contextlab.domain.model.Chunk;
import com.flamingo.ai.contextlab.domain.model.ContextProperties;
import com.flamingo.ai.contextlab.domain.model.ProcessedContext;
import com.flamingo.ai.contextlab.exception.SearchException;
import com.flamingo.ai.contextlab.service.embedding.EmbeddingService;
import com.flamingo.ai.contextlab.service.processing.AbstractContextProcessor;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * {@link ContextStorage} over a LangChain4j {@link EmbeddingStore}.
 *
 * <p>Every chunk is embedded and stored as its own segment tagged with {@code context_id}, {@code
 * chunk_index} and {@code context_type}. The context-level metadata record is kept alongside in
 * memory. A search collapses chunk hits to the closest chunk per context, with {@code distance = 1
 * - score}.
 */
@Component
@Slf4j
public class EmbeddingStoreContextStorage implements ContextStorage {

  static final String CONTEXT_ID = "context_id";
  static final String CHUNK_INDEX = "chunk_index";
  static final String CONTEXT_TYPE = "context_type";

  /** Chunk hits fetched per requested context; several chunks of one context may rank high. */
  private static final int CHUNK_CANDIDATES_PER_RESULT = 5;

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingService embeddingService;

  private final Map<String, Map<String, Object>> records = new ConcurrentHashMap<>();
  private final Map<String, List<String>> segmentIds = new ConcurrentHashMap<>();

  public EmbeddingStoreContextStorage(
      @Qualifier("chunkEmbeddingStore") EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingService embeddingService) {
    this.embeddingStore = embeddingStore;
    this.embeddingService = embeddingService;
  }

  @Override
  public List<ContextRecord> searchContext(
      String query, int topK, List<ContextType> contextTypes) {
    if (topK <= 0) {
      return List.of();
    }
    Set<String> typeValues = typeValues(contextTypes);
    try {
      if (query == null || query.isBlank()) {
        return mostRecent(topK, typeValues);
      }

      Embedding queryEmbedding = embeddingService.embedQuery(query);
      EmbeddingSearchRequest.EmbeddingSearchRequestBuilder request =
          EmbeddingSearchRequest.builder()
              .queryEmbedding(queryEmbedding)
              .maxResults(topK * CHUNK_CANDIDATES_PER_RESULT);
      if (!typeValues.isEmpty()) {
        Filter filter = metadataKey(CONTEXT_TYPE).isIn(typeValues);
        request.filter(filter);
      }

      Map<String, Double> bestDistance = new LinkedHashMap<>();
      for (EmbeddingMatch<TextSegment> match : embeddingStore.search(request.build()).matches()) {
        String contextId = match.embedded().metadata().getString(CONTEXT_ID);
        if (contextId == null || !records.containsKey(contextId)) {
          continue;
        }
        bestDistance.merge(contextId, 1.0 - match.score(), Math::min);
      }

      return bestDistance.entrySet().stream()
          .sorted(Map.Entry.comparingByValue())
          .limit(topK)
          .map(e -> new ContextRecord(e.getKey(), e.getValue(), records.get(e.getKey())))
          .collect(Collectors.toList());
    } catch (SearchException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SearchException("Context search failed: " + e.getMessage(), e);
    }
  }

  private List<ContextRecord> mostRecent(int topK, Set<String> typeValues) {
    return records.entrySet().stream()
        .filter(e -> typeValues.isEmpty() || typeValues.contains(e.getValue().get(CONTEXT_TYPE)))
        .sorted(
            Comparator.comparing(
                    (Map.Entry<String, Map<String, Object>> e) ->
                        String.valueOf(e.getValue().getOrDefault("created_time", "")))
                .reversed())
        .limit(topK)
        .map(e -> new ContextRecord(e.getKey(), 1.0, e.getValue()))
        .collect(Collectors.toList());
  }

  @Override
  public Optional<ContextRecord> getContextById(String id) {
    if (id == null) {
      return Optional.empty();
    }
    Map<String, Object> metadata = records.get(id);
    return metadata == null ? Optional.empty() : Optional.of(new ContextRecord(id, 0.0, metadata));
  }

  @Override
  public synchronized int upsertContexts(List<ProcessedContext> contexts) {
    int stored = 0;
    for (ProcessedContext context : contexts) {
      List<String> texts = context.chunks().stream().map(Chunk::text).collect(Collectors.toList());
      List<Embedding> embeddings;
      try {
        embeddings = embeddingService.embedPassages(texts);
      } catch (RuntimeException e) {
        throw new SearchException("Failed to embed context " + context.id(), e);
      }
      String contextType = context.properties().contextType().getValue();

      List<TextSegment> segments = new ArrayList<>(texts.size());
      for (Chunk chunk : context.chunks()) {
        Metadata metadata =
            new Metadata()
                .put(CONTEXT_ID, context.id())
                .put(CHUNK_INDEX, chunk.chunkIndex())
                .put(CONTEXT_TYPE, contextType);
        segments.add(TextSegment.from(chunk.text(), metadata));
      }

      List<String> added;
      try {
        added = embeddingStore.addAll(embeddings, segments);
      } catch (RuntimeException e) {
        throw new SearchException("Failed to store context " + context.id(), e);
      }
      // old segments go only once the new ones are stored
      List<String> previous = segmentIds.put(context.id(), added);
      records.put(context.id(), toRecordMetadata(context));
      if (previous != null && !previous.isEmpty()) {
        try {
          embeddingStore.removeAll(previous);
        } catch (RuntimeException e) {
          throw new SearchException("Failed to remove stale chunks of " + context.id(), e);
        }
      }
      stored++;
      log.debug("Stored context {} with {} chunk(s)", context.id(), segments.size());
    }
    return stored;
  }

  static Map<String, Object> toRecordMetadata(ProcessedContext context) {
    ContextProperties properties = context.properties();
    Map<String, Object> metadata = new LinkedHashMap<>(properties.additionalMetadata());
    metadata.put("title", properties.title());
    metadata.put("summary", properties.summary());
    metadata.put("tags", properties.tags());
    metadata.put(CONTEXT_TYPE, properties.contextType().getValue());
    metadata.put("source", properties.source().name().toLowerCase(Locale.ROOT));
    metadata.put("content_path", properties.contentPath());
    metadata.put(
        "file_extension",
        properties.contentPath() == null
            ? ""
            : AbstractContextProcessor.extensionOf(Path.of(properties.contentPath())));
    metadata.put("created_time", String.valueOf(properties.createTime()));
    metadata.put("updated_time", String.valueOf(properties.updateTime()));
    metadata.put("importance", context.extractedData().importance());
    metadata.put("confidence", context.extractedData().confidence());
    return metadata;
  }

  private static Set<String> typeValues(List<ContextType> contextTypes) {
    if (contextTypes == null) {
      return Set.of();
    }
    return contextTypes.stream().map(ContextType::getValue).collect(Collectors.toSet());
  }
}

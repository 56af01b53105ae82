package com.flamingo.ai.contextlab.service.embedding;

import com.flamingo.ai.contextlab.exception.SearchException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Embeds search queries and context chunks with the configured embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; 1 char/token keeps dense CJK text below it
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a search query.
   *
   * @param query the query text
   * @return embedding vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  @Retry(name = "openai")
  public Embedding embedQuery(String query) {
    Response<Embedding> response = embeddingModel.embed(truncate(query, "Query"));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return response.content();
  }

  /**
   * Embeds chunk texts one at a time, in order.
   *
   * @param passages chunk texts
   * @return one embedding per passage
   */
  @Timed(value = "embedding.embedPassages", description = "Time to embed passages")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedPassagesFallback")
  @Retry(name = "openai")
  public List<Embedding> embedPassages(List<String> passages) {
    List<Embedding> results = new ArrayList<>(passages.size());
    for (String passage : passages) {
      results.add(embeddingModel.embed(truncate(passage, "Passage")).content());
    }
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    return results;
  }

  private static String truncate(String text, String kind) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "{} too long for embedding, truncating from {} chars to {} chars",
        kind,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  @SuppressWarnings("unused")
  private Embedding embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    throw new SearchException("Embedding model unavailable", t);
  }

  @SuppressWarnings("unused")
  private List<Embedding> embedPassagesFallback(List<String> passages, Throwable t) {
    log.error("Embedding of {} passages failed: {}", passages.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "passage").increment();
    throw new SearchException("Embedding model unavailable", t);
  }
}

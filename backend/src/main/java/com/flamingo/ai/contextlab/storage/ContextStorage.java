package com.flamingo.ai.contextlab.storage;

import com.flamingo.ai.contextlab.domain.enums.ContextType;
import com.flamingo.ai.contextlab.domain.model.ProcessedContext;
import java.util.List;
import java.util.Optional;

/**
 * Vector-backed store of processed contexts.
 *
 * <p>Implementations signal failures with {@link
 * com.flamingo.ai.contextlab.exception.SearchException}.
 */
public interface ContextStorage {

  /**
   * Semantic search over stored contexts.
   *
   * @param query free text; blank returns the most recently created contexts
   * @param topK maximum number of records
   * @param contextTypes context types to keep; {@code null} or empty keeps all
   * @return records ordered by ascending distance
   */
  List<ContextRecord> searchContext(String query, int topK, List<ContextType> contextTypes);

  /**
   * Looks up a stored context by id.
   *
   * @param id context id
   * @return the record with distance 0, or empty when unknown
   */
  Optional<ContextRecord> getContextById(String id);

  /**
   * Stores or replaces contexts, keyed by context id.
   *
   * @param contexts processed contexts
   * @return number of contexts stored
   */
  int upsertContexts(List<ProcessedContext> contexts);
}

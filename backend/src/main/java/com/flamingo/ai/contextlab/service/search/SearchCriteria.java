package com.flamingo.ai.contextlab.service.search;

import com.flamingo.ai.contextlab.domain.enums.ContextType;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Query and filters for {@link EnhancedSearchService#search(SearchCriteria)}. */
@Value
@Builder(toBuilder = true)
public class SearchCriteria {

  /** Free-text query; blank fetches the most recent contexts. */
  @Builder.Default String query = "";

  @Builder.Default int topK = 10;

  /** Context types passed to storage as a pre-filter; empty keeps all. */
  @Builder.Default List<ContextType> contextTypes = List.of();

  /** File extensions without leading dot, e.g. {@code pdf}; empty keeps all. */
  @Builder.Default List<String> fileTypes = List.of();

  /** A result must carry at least one of these tags; empty keeps all. */
  @Builder.Default List<String> tags = List.of();

  LocalDateTime dateFrom;

  LocalDateTime dateTo;

  @Builder.Default double minRelevance = 0.0;

  @Builder.Default SortPolicy sortBy = SortPolicy.RELEVANCE;
}

package com.flamingo.ai.contextlab.service.search;

import com.flamingo.ai.contextlab.config.IngestionConfig;
import com.flamingo.ai.contextlab.domain.enums.ContextType;
import com.flamingo.ai.contextlab.storage.ContextRecord;
import com.flamingo.ai.contextlab.storage.ContextStorage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Search over stored contexts with in-process filtering, sorting and facet counts.
 *
 * <p>Storage is asked only for semantic candidates pre-filtered by context type; file type, tag,
 * date and relevance filters run on a local copy. Storage failures are logged and produce empty
 * results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnhancedSearchService {

  private static final int DEFAULT_IMPORTANCE = 50;
  private static final int CANDIDATE_MULTIPLIER = 2;
  private static final int TAGS_PER_RESULT_IN_FACETS = 5;

  private static final DateTimeFormatter ISO_TIMESTAMP =
      new DateTimeFormatterBuilder()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .optionalStart()
          .appendLiteral('T')
          .append(DateTimeFormatter.ISO_LOCAL_TIME)
          .optionalStart()
          .appendOffsetId()
          .optionalEnd()
          .optionalEnd()
          .toFormatter();

  private final ContextStorage contextStorage;
  private final IngestionConfig ingestionConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Searches with filters and sorting.
   *
   * @param criteria query, filters and sort policy
   * @return at most {@code topK} results
   */
  @Timed(value = "search.enhanced", description = "Time for filtered context search")
  public List<ContextSearchResult> search(SearchCriteria criteria) {
    meterRegistry.counter("search.requests", "operation", "search").increment();
    try {
      return doSearch(criteria);
    } catch (RuntimeException e) {
      meterRegistry.counter("search.failures", "operation", "search").increment();
      log.error("Error in enhanced search for '{}': {}", criteria.getQuery(), e.getMessage(), e);
      return List.of();
    }
  }

  private List<ContextSearchResult> doSearch(SearchCriteria criteria) {
    int topK = criteria.getTopK();
    if (topK <= 0) {
      return List.of();
    }
    List<ContextRecord> candidates =
        contextStorage.searchContext(
            criteria.getQuery(), topK * CANDIDATE_MULTIPLIER, nonNull(criteria.getContextTypes()));
    if (candidates == null || candidates.isEmpty()) {
      return List.of();
    }

    Set<String> fileTypes = new HashSet<>(nonNull(criteria.getFileTypes()));
    List<String> tags = nonNull(criteria.getTags());

    List<ContextSearchResult> filtered = new ArrayList<>();
    for (ContextRecord candidate : candidates) {
      double relevance = 1.0 - candidate.distance();
      if (relevance < criteria.getMinRelevance()) {
        continue;
      }
      if (!fileTypes.isEmpty() && !fileTypes.contains(fileTypeOf(candidate))) {
        continue;
      }
      if (!tags.isEmpty() && tags.stream().noneMatch(candidate.tags()::contains)) {
        continue;
      }
      if (!withinDateRange(candidate, criteria.getDateFrom(), criteria.getDateTo())) {
        continue;
      }
      filtered.add(
          new ContextSearchResult(
              candidate.id(),
              candidate.distance(),
              candidate.metadata(),
              relevance,
              importanceOf(candidate)));
    }

    filtered.sort(comparatorFor(criteria.getSortBy()));
    log.debug(
        "Search '{}' kept {} of {} candidates",
        criteria.getQuery(),
        filtered.size(),
        candidates.size());
    return filtered.size() > topK ? List.copyOf(filtered.subList(0, topK)) : filtered;
  }

  /**
   * Searches by tags, using the tags joined by spaces as the query.
   *
   * @param tags tags to look for
   * @param topK maximum results
   * @param matchAll when true, every result carries all requested tags
   * @return matching results
   */
  public List<ContextSearchResult> searchByTags(List<String> tags, int topK, boolean matchAll) {
    if (tags == null || tags.isEmpty()) {
      return List.of();
    }
    List<ContextSearchResult> results =
        search(
            SearchCriteria.builder().query(String.join(" ", tags)).topK(topK).tags(tags).build());
    if (!matchAll) {
      return results;
    }
    return results.stream()
        .filter(r -> r.tags().containsAll(tags))
        .limit(topK)
        .collect(Collectors.toList());
  }

  /**
   * Returns contexts created within the last {@code days} days, newest first.
   *
   * @param days look-back window
   * @param topK maximum results
   * @param contextTypes context type pre-filter; empty keeps all
   * @return recent results
   */
  public List<ContextSearchResult> searchRecent(
      int days, int topK, List<ContextType> contextTypes) {
    LocalDateTime dateFrom = LocalDateTime.now(clock).minusDays(days);
    return search(
        SearchCriteria.builder()
            .query("")
            .topK(topK)
            .contextTypes(nonNull(contextTypes))
            .dateFrom(dateFrom)
            .sortBy(SortPolicy.DATE)
            .build());
  }

  /**
   * Finds contexts similar to a stored one, using its summary (or title) as the query.
   *
   * @param contextId origin context id; never part of the result
   * @param topK maximum results
   * @return similar results, empty when the origin is unknown or has no summary or title
   */
  public List<ContextSearchResult> searchSimilar(String contextId, int topK) {
    Optional<ContextRecord> origin;
    try {
      origin = contextStorage.getContextById(contextId);
    } catch (RuntimeException e) {
      meterRegistry.counter("search.failures", "operation", "similar").increment();
      log.error("Error loading context {} for similarity search: {}", contextId, e.getMessage(), e);
      return List.of();
    }
    if (origin.isEmpty()) {
      log.warn("Context not found: {}", contextId);
      return List.of();
    }

    String query =
        firstNonBlank(origin.get().getString("summary"), origin.get().getString("title"));
    if (query == null) {
      return List.of();
    }
    return search(SearchCriteria.builder().query(query).topK(topK + 1).build()).stream()
        .filter(r -> !r.id().equals(contextId))
        .limit(topK)
        .collect(Collectors.toList());
  }

  /**
   * Computes facet counts over up to {@code facetCandidates} contexts.
   *
   * @param query optional query scoping the candidates
   * @param contextTypes context type pre-filter; empty keeps all
   * @return facet counts; empty facets on storage failure
   */
  @Timed(value = "search.facets", description = "Time to compute search facets")
  public SearchFacets getFacets(String query, List<ContextType> contextTypes) {
    int candidates = ingestionConfig.getSearch().getFacetCandidates();
    List<Map<String, Object>> views;
    try {
      if (query != null && !query.isBlank()) {
        views =
            doSearch(
                    SearchCriteria.builder()
                        .query(query)
                        .topK(candidates)
                        .contextTypes(nonNull(contextTypes))
                        .build())
                .stream()
                .map(ContextSearchResult::metadata)
                .collect(Collectors.toList());
      } else {
        views =
            contextStorage.searchContext("", candidates, nonNull(contextTypes)).stream()
                .map(ContextRecord::metadata)
                .collect(Collectors.toList());
      }
    } catch (RuntimeException e) {
      meterRegistry.counter("search.failures", "operation", "facets").increment();
      log.error("Error getting facets: {}", e.getMessage(), e);
      return SearchFacets.empty();
    }
    return computeFacets(views);
  }

  private SearchFacets computeFacets(List<Map<String, Object>> candidates) {
    Map<String, Long> fileTypes = new LinkedHashMap<>();
    Map<String, Long> contextTypes = new LinkedHashMap<>();
    Map<String, Long> tags = new HashMap<>();
    long lastDay = 0;
    long lastWeek = 0;
    long lastMonth = 0;
    long older = 0;
    LocalDateTime now = LocalDateTime.now(clock);

    for (Map<String, Object> metadata : candidates) {
      Object extension = metadata.get("file_extension");
      String fileType = extension == null ? "unknown" : stripDot(extension.toString());
      fileTypes.merge(fileType, 1L, Long::sum);

      Object contextType = metadata.getOrDefault("context_type", "unknown");
      contextTypes.merge(String.valueOf(contextType), 1L, Long::sum);

      Object tagValue = metadata.get("tags");
      if (tagValue instanceof List<?>) {
        List<?> resultTags = (List<?>) tagValue;
        resultTags.stream()
            .limit(TAGS_PER_RESULT_IN_FACETS)
            .forEach(tag -> tags.merge(String.valueOf(tag), 1L, Long::sum));
      }

      Optional<LocalDateTime> created = parseTimestamp(metadata.get("created_time"));
      if (created.isPresent()) {
        long daysAgo = Duration.between(created.get(), now).toDays();
        if (daysAgo < 1) {
          lastDay++;
        } else if (daysAgo < 7) {
          lastWeek++;
        } else if (daysAgo < 30) {
          lastMonth++;
        } else {
          older++;
        }
      }
    }

    Map<String, Long> topTags =
        tags.entrySet().stream()
            .sorted(
                Map.Entry.<String, Long>comparingByValue()
                    .reversed()
                    .thenComparing(Map.Entry.comparingByKey()))
            .limit(ingestionConfig.getSearch().getMaxTagFacets())
            .collect(
                Collectors.toMap(
                    Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));

    return new SearchFacets(
        fileTypes,
        contextTypes,
        topTags,
        new SearchFacets.DateRanges(lastDay, lastWeek, lastMonth, older));
  }

  private static boolean withinDateRange(
      ContextRecord candidate, LocalDateTime dateFrom, LocalDateTime dateTo) {
    if (dateFrom == null && dateTo == null) {
      return true;
    }
    Optional<LocalDateTime> created = parseTimestamp(candidate.metadata().get("created_time"));
    if (created.isEmpty()) {
      return true;
    }
    if (dateFrom != null && created.get().isBefore(dateFrom)) {
      return false;
    }
    return dateTo == null || !created.get().isAfter(dateTo);
  }

  /**
   * Parses an ISO-8601 timestamp: local date-time, offset date-time or plain date.
   *
   * @param value stored value
   * @return parsed local date-time, or empty when missing or unparseable
   */
  static Optional<LocalDateTime> parseTimestamp(Object value) {
    if (value == null || value.toString().isBlank()) {
      return Optional.empty();
    }
    String text = value.toString().strip();
    try {
      TemporalAccessor parsed =
          ISO_TIMESTAMP.parseBest(
              text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
      if (parsed instanceof OffsetDateTime) {
        return Optional.of(((OffsetDateTime) parsed).toLocalDateTime());
      }
      if (parsed instanceof LocalDate) {
        return Optional.of(((LocalDate) parsed).atStartOfDay());
      }
      return Optional.of((LocalDateTime) parsed);
    } catch (DateTimeParseException e) {
      log.debug("Unparseable timestamp '{}'", text);
      return Optional.empty();
    }
  }

  private static Comparator<ContextSearchResult> comparatorFor(SortPolicy sortBy) {
    if (sortBy == SortPolicy.DATE) {
      return Comparator.comparing(ContextSearchResult::createdTime).reversed();
    }
    if (sortBy == SortPolicy.IMPORTANCE) {
      return Comparator.comparingInt(ContextSearchResult::importance).reversed();
    }
    return Comparator.comparingDouble(ContextSearchResult::relevanceScore).reversed();
  }

  private static String fileTypeOf(ContextRecord candidate) {
    String extension = candidate.getString("file_extension");
    return extension == null ? "" : stripDot(extension);
  }

  private static int importanceOf(ContextRecord candidate) {
    Object value = candidate.metadata().get("importance");
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value != null) {
      try {
        return Integer.parseInt(value.toString().strip());
      } catch (NumberFormatException e) {
        log.debug("Non-numeric importance '{}' on {}", value, candidate.id());
      }
    }
    return DEFAULT_IMPORTANCE;
  }

  private static String stripDot(String extension) {
    return extension.startsWith(".") ? extension.substring(1) : extension;
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first;
    }
    return second != null && !second.isBlank() ? second : null;
  }

  private static <T> List<T> nonNull(List<T> values) {
    return values == null ? List.of() : values;
  }
}

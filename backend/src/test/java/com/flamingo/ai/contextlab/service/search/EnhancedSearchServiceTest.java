package com.flamingo.ai.contextlab.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contextlab.config.IngestionConfig;
import com.flamingo.ai.contextlab.domain.enums.ContextType;
import com.flamingo.ai.contextlab.exception.SearchException;
import com.flamingo.ai.contextlab.storage.ContextRecord;
import com.flamingo.ai.contextlab.storage.ContextStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EnhancedSearchService Tests")
class EnhancedSearchServiceTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

  @Mock private ContextStorage contextStorage;

  private SimpleMeterRegistry meterRegistry;
  private EnhancedSearchService searchService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    searchService =
        new EnhancedSearchService(contextStorage, new IngestionConfig(), meterRegistry, CLOCK);
  }

  private static ContextRecord record(
      String id, double distance, String extension, List<String> tags, String created) {
    return record(id, distance, extension, tags, created, null);
  }

  private static ContextRecord record(
      String id,
      double distance,
      String extension,
      List<String> tags,
      String created,
      Object importance) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("title", "Title " + id);
    metadata.put("summary", "Summary of " + id);
    metadata.put("file_extension", extension);
    metadata.put("tags", tags);
    metadata.put("context_type", "semantic_context");
    metadata.put("created_time", created);
    if (importance != null) {
      metadata.put("importance", importance);
    }
    return new ContextRecord(id, distance, metadata);
  }

  private void givenCandidates(ContextRecord... records) {
    when(contextStorage.searchContext(anyString(), anyInt(), anyList()))
        .thenReturn(List.of(records));
  }

  private static List<String> ids(List<ContextSearchResult> results) {
    return results.stream().map(ContextSearchResult::id).toList();
  }

  @Nested
  @DisplayName("Filtered search")
  class FilteredSearch {

    @Test
    @DisplayName("Should request twice topK candidates from storage")
    void shouldOverFetchCandidates() {
      givenCandidates();

      searchService.search(SearchCriteria.builder().query("budget").topK(10).build());

      verify(contextStorage).searchContext("budget", 20, List.of());
    }

    @Test
    @DisplayName("Should drop results below the minimum relevance")
    void shouldApplyMinRelevance() {
      givenCandidates(
          record("far", 0.9, ".pdf", List.of(), "2024-06-01T00:00:00"),
          record("mid", 0.5, ".pdf", List.of(), "2024-06-01T00:00:00"),
          record("near", 0.1, ".pdf", List.of(), "2024-06-01T00:00:00"));

      List<ContextSearchResult> results =
          searchService.search(SearchCriteria.builder().query("q").minRelevance(0.4).build());

      assertThat(ids(results)).containsExactly("near", "mid");
      assertThat(results.get(0).relevanceScore()).isEqualTo(0.9);
      assertThat(results).allMatch(r -> r.relevanceScore() >= 0.4);
    }

    @Test
    @DisplayName("Should filter by file type with or without the stored dot")
    void shouldFilterByFileType() {
      givenCandidates(
          record("a", 0.1, ".pdf", List.of(), "2024-06-01T00:00:00"),
          record("b", 0.2, ".xlsx", List.of(), "2024-06-01T00:00:00"),
          record("c", 0.3, "pdf", List.of(), "2024-06-01T00:00:00"));

      List<ContextSearchResult> results =
          searchService.search(
              SearchCriteria.builder().query("q").fileTypes(List.of("pdf")).build());

      assertThat(ids(results)).containsExactly("a", "c");
    }

    @Test
    @DisplayName("Should keep results carrying any requested tag")
    void shouldFilterByAnyTag() {
      givenCandidates(
          record("a", 0.1, ".md", List.of("finance"), "2024-06-01T00:00:00"),
          record("b", 0.2, ".md", List.of("legal"), "2024-06-01T00:00:00"),
          record("c", 0.3, ".md", List.of("hr", "finance"), "2024-06-01T00:00:00"));

      List<ContextSearchResult> results =
          searchService.search(
              SearchCriteria.builder().query("q").tags(List.of("finance", "hr")).build());

      assertThat(ids(results)).containsExactly("a", "c");
    }

    @Test
    @DisplayName("Should filter by creation date and keep undated results")
    void shouldFilterByDate() {
      givenCandidates(
          record("old", 0.1, ".md", List.of(), "2024-01-01T00:00:00"),
          record("new", 0.2, ".md", List.of(), "2024-06-14T00:00:00"),
          record("undated", 0.3, ".md", List.of(), "not a date"));

      List<ContextSearchResult> results =
          searchService.search(
              SearchCriteria.builder()
                  .query("q")
                  .dateFrom(LocalDateTime.of(2024, 6, 1, 0, 0))
                  .dateTo(LocalDateTime.of(2024, 6, 30, 0, 0))
                  .build());

      assertThat(ids(results)).containsExactly("new", "undated");
    }

    @Test
    @DisplayName("Should sort by importance with a default of 50")
    void shouldSortByImportance() {
      givenCandidates(
          record("low", 0.1, ".md", List.of(), "2024-06-01T00:00:00", 10),
          record("default", 0.2, ".md", List.of(), "2024-06-01T00:00:00"),
          record("high", 0.3, ".md", List.of(), "2024-06-01T00:00:00", "90"));

      List<ContextSearchResult> results =
          searchService.search(
              SearchCriteria.builder().query("q").sortBy(SortPolicy.IMPORTANCE).build());

      assertThat(ids(results)).containsExactly("high", "default", "low");
      assertThat(results.get(1).importance()).isEqualTo(50);
    }

    @Test
    @DisplayName("Should sort by creation date newest first and cap at topK")
    void shouldSortByDateAndCap() {
      givenCandidates(
          record("a", 0.1, ".md", List.of(), "2024-06-01T00:00:00"),
          record("b", 0.2, ".md", List.of(), "2024-06-10T00:00:00"),
          record("c", 0.3, ".md", List.of(), "2024-06-05T00:00:00"));

      List<ContextSearchResult> results =
          searchService.search(
              SearchCriteria.builder().query("q").topK(2).sortBy(SortPolicy.DATE).build());

      assertThat(ids(results)).containsExactly("b", "c");
    }

    @Test
    @DisplayName("Should return empty and count a failure when storage fails")
    void shouldReturnEmptyOnStorageFailure() {
      when(contextStorage.searchContext(anyString(), anyInt(), anyList()))
          .thenThrow(new SearchException("store down"));

      List<ContextSearchResult> results =
          searchService.search(SearchCriteria.builder().query("q").build());

      assertThat(results).isEmpty();
      assertThat(meterRegistry.counter("search.failures", "operation", "search").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return empty for a non-positive topK without calling storage")
    void shouldReturnEmptyForZeroTopK() {
      assertThat(searchService.search(SearchCriteria.builder().query("q").topK(0).build()))
          .isEmpty();
    }
  }

  @Nested
  @DisplayName("Convenience searches")
  class ConvenienceSearches {

    @Test
    @DisplayName("Should require every tag when matchAll is set")
    void shouldMatchAllTags() {
      givenCandidates(
          record("both", 0.1, ".md", List.of("x", "y"), "2024-06-01T00:00:00"),
          record("one", 0.2, ".md", List.of("x"), "2024-06-01T00:00:00"));

      assertThat(ids(searchService.searchByTags(List.of("x", "y"), 10, true)))
          .containsExactly("both");
      assertThat(ids(searchService.searchByTags(List.of("x", "y"), 10, false)))
          .containsExactly("both", "one");
      verify(contextStorage, times(2)).searchContext(eq("x y"), eq(20), anyList());
    }

    @Test
    @DisplayName("Should return recent contexts newest first")
    void shouldSearchRecent() {
      givenCandidates(
          record("week", 1.0, ".md", List.of(), "2024-06-10T00:00:00"),
          record("day", 1.0, ".md", List.of(), "2024-06-15T06:00:00"),
          record("stale", 1.0, ".md", List.of(), "2024-05-01T00:00:00"));

      List<ContextSearchResult> results =
          searchService.searchRecent(7, 10, List.of(ContextType.SEMANTIC_CONTEXT));

      assertThat(ids(results)).containsExactly("day", "week");
      verify(contextStorage).searchContext("", 20, List.of(ContextType.SEMANTIC_CONTEXT));
    }

    @Test
    @DisplayName("Should find similar contexts excluding the origin")
    void shouldSearchSimilar() {
      ContextRecord origin = record("origin", 0.0, ".md", List.of(), "2024-06-01T00:00:00");
      when(contextStorage.getContextById("origin")).thenReturn(Optional.of(origin));
      givenCandidates(
          record("origin", 0.0, ".md", List.of(), "2024-06-01T00:00:00"),
          record("other", 0.2, ".md", List.of(), "2024-06-01T00:00:00"));

      List<ContextSearchResult> results = searchService.searchSimilar("origin", 5);

      assertThat(ids(results)).containsExactly("other");
      verify(contextStorage).searchContext("Summary of origin", 12, List.of());
    }

    @Test
    @DisplayName("Should return empty for an unknown origin")
    void shouldReturnEmptyForUnknownOrigin() {
      when(contextStorage.getContextById("missing")).thenReturn(Optional.empty());

      assertThat(searchService.searchSimilar("missing", 5)).isEmpty();
    }

    @Test
    @DisplayName("Should return empty when the origin has neither summary nor title")
    void shouldReturnEmptyWithoutQueryText() {
      when(contextStorage.getContextById("bare"))
          .thenReturn(Optional.of(new ContextRecord("bare", 0.0, Map.of("tags", List.of()))));

      assertThat(searchService.searchSimilar("bare", 5)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Facets")
  class Facets {

    @Test
    @DisplayName("Should count file types, tags and disjoint date buckets")
    void shouldComputeFacets() {
      givenCandidates(
          record("a", 1.0, ".pdf", List.of("finance", "q2"), "2024-06-15T08:00:00"),
          record("b", 1.0, ".pdf", List.of("finance"), "2024-06-12T00:00:00"),
          record("c", 1.0, ".py", List.of("code"), "2024-06-01T00:00:00"),
          record("d", 1.0, null, List.of(), "2024-01-01"),
          record("e", 1.0, ".py", List.of(), "garbage"));

      SearchFacets facets = searchService.getFacets(null, null);

      assertThat(facets.fileTypes())
          .containsEntry("pdf", 2L)
          .containsEntry("py", 2L)
          .containsEntry("unknown", 1L);
      assertThat(facets.contextTypes()).containsEntry("semantic_context", 5L);
      assertThat(facets.tags().keySet()).first().isEqualTo("finance");
      assertThat(facets.tags()).containsEntry("finance", 2L).containsEntry("code", 1L);
      assertThat(facets.dateRanges()).isEqualTo(new SearchFacets.DateRanges(1, 1, 1, 1));
      assertThat(facets.dateRanges().total()).isEqualTo(4);
      verify(contextStorage).searchContext("", 100, List.of());
    }

    @Test
    @DisplayName("Should scope facets by query through the filtered search")
    void shouldScopeFacetsByQuery() {
      givenCandidates(record("a", 0.1, ".md", List.of(), "2024-06-15T08:00:00"));

      SearchFacets facets =
          searchService.getFacets("budget", List.of(ContextType.SEMANTIC_CONTEXT));

      assertThat(facets.fileTypes()).containsEntry("md", 1L);
      verify(contextStorage).searchContext("budget", 200, List.of(ContextType.SEMANTIC_CONTEXT));
    }

    @Test
    @DisplayName("Should return empty facets when storage fails")
    void shouldReturnEmptyFacetsOnFailure() {
      when(contextStorage.searchContext(anyString(), anyInt(), anyList()))
          .thenThrow(new SearchException("store down"));

      assertThat(searchService.getFacets("", null)).isEqualTo(SearchFacets.empty());
    }
  }

  @Test
  @DisplayName("Should parse local, offset and date-only timestamps")
  void shouldParseTimestamps() {
    assertThat(EnhancedSearchService.parseTimestamp("2024-06-15T08:30:00"))
        .contains(LocalDateTime.of(2024, 6, 15, 8, 30));
    assertThat(EnhancedSearchService.parseTimestamp("2024-06-15T08:30:00.123+02:00"))
        .contains(LocalDateTime.of(2024, 6, 15, 8, 30, 0, 123_000_000));
    assertThat(EnhancedSearchService.parseTimestamp("2024-06-15"))
        .contains(LocalDateTime.of(2024, 6, 15, 0, 0));
    assertThat(EnhancedSearchService.parseTimestamp("yesterday")).isEmpty();
    assertThat(EnhancedSearchService.parseTimestamp(null)).isEmpty();
  }
}

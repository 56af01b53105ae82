package com.flamingo.ai.contextlab.service.search;

import java.util.Map;

/**
 * Aggregated counts over a candidate set.
 *
 * @param fileTypes count per file extension without dot, {@code unknown} when missing
 * @param contextTypes count per stored context type
 * @param tags count per tag, ordered by count descending
 * @param dateRanges creation-age histogram
 */
public record SearchFacets(
    Map<String, Long> fileTypes,
    Map<String, Long> contextTypes,
    Map<String, Long> tags,
    DateRanges dateRanges) {

  public static SearchFacets empty() {
    return new SearchFacets(Map.of(), Map.of(), Map.of(), new DateRanges(0, 0, 0, 0));
  }

  /** Disjoint age buckets: under 1 day, under 7, under 30, and older. */
  public record DateRanges(long lastDay, long lastWeek, long lastMonth, long older) {

    public long total() {
      return lastDay + lastWeek + lastMonth + older;
    }
  }
}

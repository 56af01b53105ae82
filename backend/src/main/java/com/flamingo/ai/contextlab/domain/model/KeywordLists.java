package com.flamingo.ai.contextlab.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Helpers for the keyword, entity and tag lists carried by the context model. */
public final class KeywordLists {

  private KeywordLists() {}

  /**
   * De-duplicates case-insensitively, keeping the first spelling seen and the original order.
   * Null and blank entries are dropped.
   *
   * @param values input values
   * @return unmodifiable de-duplicated list
   */
  public static List<String> distinct(Collection<String> values) {
    List<String> result = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (String value : values) {
      if (value == null || value.isBlank()) {
        continue;
      }
      if (seen.add(value.toLowerCase(Locale.ROOT))) {
        result.add(value);
      }
    }
    return List.copyOf(result);
  }

  /** Concatenates the lists and de-duplicates the result with {@link #distinct}. */
  @SafeVarargs
  public static List<String> merge(Collection<String>... lists) {
    List<String> all = new ArrayList<>();
    for (Collection<String> list : lists) {
      if (list != null) {
        all.addAll(list);
      }
    }
    return distinct(all);
  }
}

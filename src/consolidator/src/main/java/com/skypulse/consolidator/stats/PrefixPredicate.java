package com.skypulse.consolidator.stats;

import com.skypulse.consolidator.region.RegionPrefixes;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds parameterized {@code LIKE 'prefix%'} disjunctions for region filtering.
 */
final class PrefixPredicate {

  private PrefixPredicate() {}

  /**
   * Returns a SQL predicate matching {@code column} against any prefix and appends the bound
   * values to {@code params}. No prefix yields a predicate that is always false.
   */
  static String likeAny(String column, RegionPrefixes prefixes, List<Object> params) {
    if (prefixes.isEmpty()) {
      return "(1 = 0)";
    }
    List<String> clauses = new ArrayList<>(prefixes.values().size());
    for (String prefix : prefixes.values()) {
      clauses.add(column + " LIKE ? ESCAPE '\\'");
      params.add(escape(prefix) + "%");
    }
    return "(" + String.join(" OR ", clauses) + ")";
  }

  static String escape(String prefix) {
    return prefix.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}

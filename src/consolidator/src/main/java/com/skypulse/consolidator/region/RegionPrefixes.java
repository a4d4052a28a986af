package com.skypulse.consolidator.region;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ordered, immutable set of region prefixes matched against the start of airport codes and
 * controller callsigns.
 *
 * <p>Prefixes are trimmed and upper-cased; blank entries and duplicates are dropped.
 */
public record RegionPrefixes(List<String> values) {

  public RegionPrefixes {
    Set<String> normalized = new LinkedHashSet<>();
    if (values != null) {
      for (String value : values) {
        if (value != null && !value.isBlank()) {
          normalized.add(value.trim().toUpperCase(Locale.ROOT));
        }
      }
    }
    values = List.copyOf(new ArrayList<>(normalized));
  }

  public static RegionPrefixes of(String... prefixes) {
    return new RegionPrefixes(List.of(prefixes));
  }

  public static RegionPrefixes of(Collection<String> prefixes) {
    return new RegionPrefixes(prefixes == null ? List.of() : new ArrayList<>(prefixes));
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /**
   * Tests whether a code starts with any configured prefix.
   *
   * @param code airport code or callsign, may be null
   * @return {@code true} on a match
   */
  public boolean matches(String code) {
    if (code == null || code.isEmpty()) {
      return false;
    }
    String upper = code.toUpperCase(Locale.ROOT);
    for (String prefix : values) {
      if (upper.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}

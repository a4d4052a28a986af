package com.skypulse.consolidator.collector;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shortens filed routes for display: drops {@code DCT} and coordinate waypoints, strips
 * speed/level suffixes and keeps only the first and last two segments of long routes.
 */
public final class RouteNormalizer {
  public static final String NO_ROUTE = "No route";

  private static final Pattern COORDINATE = Pattern.compile(
      "^(\\d{2,4}[NS]\\d{3,5}[EW]|\\d{1,2}[NS]\\d{1,3}[EW]|-?\\d+(\\.\\d+)?,-?\\d+(\\.\\d+)?)$");
  private static final int MAX_SEGMENTS = 4;

  private RouteNormalizer() {}

  /**
   * Normalizes a route.
   *
   * @param route raw route, may be null
   * @return {@link #NO_ROUTE} for a missing route, {@code DCT} when nothing remains, the
   *     shortened route otherwise
   */
  public static String normalize(String route) {
    if (route == null || route.isBlank()) {
      return NO_ROUTE;
    }
    if (NO_ROUTE.equals(route)) {
      return route;
    }

    List<String> segments = new ArrayList<>();
    for (String token : route.trim().split("\\s+")) {
      String segment = token.split("/", 2)[0];
      if (segment.isEmpty()
          || "DCT".equals(segment.toUpperCase(Locale.ROOT))
          || COORDINATE.matcher(token.toUpperCase(Locale.ROOT)).matches()) {
        continue;
      }
      segments.add(segment);
    }

    if (segments.isEmpty()) {
      return "DCT";
    }
    if (segments.size() > MAX_SEGMENTS) {
      return String.join(" ", segments.subList(0, 2))
          + "..."
          + String.join(" ", segments.subList(segments.size() - 2, segments.size()));
    }
    return String.join(" ", segments);
  }
}

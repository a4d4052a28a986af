package com.skypulse.consolidator.model;

import java.util.List;

/**
 * Ordered chart-ready series for one window.
 *
 * @param windowType window the series was extracted for
 * @param points ordered points, never empty for live and daily windows
 */
public record ChartSeries(WindowType windowType, List<Point> points) {

  public ChartSeries {
    points = List.copyOf(points);
  }

  public List<String> labels() {
    return points.stream().map(Point::label).toList();
  }

  public List<Integer> participantCounts() {
    return points.stream().map(Point::participants).toList();
  }

  public List<Integer> controllerCounts() {
    return points.stream().map(Point::controllers).toList();
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  /**
   * One point of the series.
   *
   * @param label x-axis label ({@code HH:mm} or {@code dd/MM})
   * @param participants pilot count
   * @param controllers controller count
   */
  public record Point(String label, int participants, int controllers) {}
}

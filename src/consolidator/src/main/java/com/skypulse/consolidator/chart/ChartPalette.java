package com.skypulse.consolidator.chart;

import com.skypulse.consolidator.model.WindowType;

/**
 * Line colors of a chart, as {@code #RRGGBB} strings.
 *
 * @param primary pilot line color
 * @param secondary controller line color
 */
public record ChartPalette(String primary, String secondary) {

  /**
   * Returns the default palette of a window. The live palette turns red when no controller is
   * on duty.
   */
  public static ChartPalette forWindow(WindowType windowType, boolean controllersActive) {
    return switch (windowType) {
      case LIVE -> controllersActive
          ? new ChartPalette("#2FFF9A", "#A0FFD1")
          : new ChartPalette("#FF5250", "#FFA5A3");
      case DAILY -> new ChartPalette("#007BFF", "#80DFFF");
      case WEEKLY -> new ChartPalette("#8000FF", "#D580FF");
      case MONTHLY -> new ChartPalette("#AAAAAA", "#FFFFFF");
    };
  }
}

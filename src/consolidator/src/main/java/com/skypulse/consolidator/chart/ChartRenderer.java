package com.skypulse.consolidator.chart;

import com.skypulse.consolidator.model.ChartSeries;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a series into an image file. Implementations need not be thread-safe: callers
 * serialize render calls.
 */
public interface ChartRenderer {
  void render(ChartSeries series, ChartPalette palette, Path target) throws IOException;
}

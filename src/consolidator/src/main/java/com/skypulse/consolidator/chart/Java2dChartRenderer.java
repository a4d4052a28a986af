package com.skypulse.consolidator.chart;

import com.skypulse.consolidator.config.ConsolidatorProperties;
import com.skypulse.consolidator.model.ChartSeries;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import javax.imageio.ImageIO;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Headless PNG line chart: pilots in the primary color, controllers in the secondary color,
 * on a dark background.
 */
@Component
public class Java2dChartRenderer implements ChartRenderer {
  private static final Color BACKGROUND = new Color(0x2B, 0x2D, 0x31);
  private static final Color AXIS = new Color(0x8E, 0x92, 0x97);
  private static final int MARGIN = 48;
  private static final int MAX_X_LABELS = 8;

  private final int width;
  private final int height;

  @Autowired
  public Java2dChartRenderer(ConsolidatorProperties properties) {
    this(properties.getChart().getWidth(), properties.getChart().getHeight());
  }

  Java2dChartRenderer(int width, int height) {
    this.width = Math.max(2 * MARGIN + 10, width);
    this.height = Math.max(2 * MARGIN + 10, height);
  }

  @Override
  public void render(ChartSeries series, ChartPalette palette, Path target) throws IOException {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = image.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      g.setColor(BACKGROUND);
      g.fillRect(0, 0, width, height);

      List<ChartSeries.Point> points = series.points();
      int max = 1;
      for (ChartSeries.Point point : points) {
        max = Math.max(max, Math.max(point.participants(), point.controllers()));
      }

      int plotWidth = width - 2 * MARGIN;
      int plotHeight = height - 2 * MARGIN;
      g.setColor(AXIS);
      g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 11));
      g.drawLine(MARGIN, height - MARGIN, width - MARGIN, height - MARGIN);
      g.drawLine(MARGIN, MARGIN, MARGIN, height - MARGIN);
      g.drawString(Integer.toString(max), 8, MARGIN + 4);
      g.drawString("0", 8, height - MARGIN + 4);

      int step = Math.max(1, (points.size() + MAX_X_LABELS - 1) / MAX_X_LABELS);
      for (int i = 0; i < points.size(); i += step) {
        g.drawString(points.get(i).label(), x(i, points.size(), plotWidth) - 14, height - MARGIN + 18);
      }

      g.setStroke(new BasicStroke(2f));
      drawLine(g, points, true, max, plotWidth, plotHeight, Color.decode(palette.primary()));
      drawLine(g, points, false, max, plotWidth, plotHeight, Color.decode(palette.secondary()));
    } finally {
      g.dispose();
    }

    writeAtomically(image, target);
  }

  /**
   * Writes the PNG next to {@code target} and moves it into place, so a reader streaming the
   * previous file never sees a partially written one.
   */
  static void writeAtomically(BufferedImage image, Path target) throws IOException {
    Path directory = target.toAbsolutePath().getParent();
    Files.createDirectories(directory);
    Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
    try {
      if (!ImageIO.write(image, "png", temp.toFile())) {
        throw new IOException("No PNG writer available for " + target);
      }
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private void drawLine(
      Graphics2D g,
      List<ChartSeries.Point> points,
      boolean participants,
      int max,
      int plotWidth,
      int plotHeight,
      Color color) {
    g.setColor(color);
    for (int i = 1; i < points.size(); i++) {
      int previous = participants ? points.get(i - 1).participants() : points.get(i - 1).controllers();
      int current = participants ? points.get(i).participants() : points.get(i).controllers();
      g.drawLine(
          x(i - 1, points.size(), plotWidth), y(previous, max, plotHeight),
          x(i, points.size(), plotWidth), y(current, max, plotHeight));
    }
  }

  private int x(int index, int count, int plotWidth) {
    if (count <= 1) {
      return MARGIN;
    }
    return MARGIN + (int) Math.round((double) index * plotWidth / (count - 1));
  }

  private int y(int value, int max, int plotHeight) {
    return height - MARGIN - (int) Math.round((double) value * plotHeight / max);
  }
}

package com.skypulse.consolidator.chart;

import com.skypulse.consolidator.config.ConsolidatorProperties;
import com.skypulse.consolidator.model.ChartSeries;
import com.skypulse.consolidator.model.WindowType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Memoizes chart series and rendered chart files for a short TTL.
 *
 * <p>Series are cached per window type. Artifacts are cached per (window, name, colors). Only
 * the render step is serialized: extraction and cache reads run concurrently, and a thread that
 * waited for the render lock checks the cache again before rendering.
 */
@Service
public class ChartService {
  private static final Logger log = LoggerFactory.getLogger(ChartService.class);

  private final TimeSeriesExtractor extractor;
  private final ChartRenderer renderer;
  private final Path outputDir;
  private final TtlCache<WindowType, ChartSeries> seriesCache;
  private final TtlCache<ChartKey, Path> artifactCache;
  private final ReentrantLock renderLock = new ReentrantLock();
  private final Counter seriesHitCounter;
  private final Counter seriesMissCounter;
  private final Counter artifactHitCounter;
  private final Counter artifactMissCounter;
  private final Counter renderCounter;
  private final Counter evictionCounter;

  @Autowired
  public ChartService(
      TimeSeriesExtractor extractor,
      ChartRenderer renderer,
      ConsolidatorProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this(
        extractor,
        renderer,
        Path.of(properties.getChart().getOutputDir()),
        clock,
        Duration.ofSeconds(properties.getChart().getCacheTtlSeconds()),
        Duration.ofSeconds(properties.getChart().getSweepIntervalSeconds()),
        meterRegistry);
  }

  ChartService(
      TimeSeriesExtractor extractor,
      ChartRenderer renderer,
      Path outputDir,
      Clock clock,
      Duration ttl,
      Duration sweepInterval,
      MeterRegistry meterRegistry) {
    this.extractor = extractor;
    this.renderer = renderer;
    this.outputDir = outputDir;
    this.evictionCounter = meterRegistry.counter("consolidator.chart.cache.evictions");
    this.seriesCache = new TtlCache<>(clock, ttl, sweepInterval);
    this.artifactCache = new TtlCache<>(clock, ttl, sweepInterval, Files::exists, this::deleteArtifact);
    this.seriesHitCounter = meterRegistry.counter("consolidator.chart.cache.hits", "cache", "series");
    this.seriesMissCounter = meterRegistry.counter("consolidator.chart.cache.misses", "cache", "series");
    this.artifactHitCounter = meterRegistry.counter("consolidator.chart.cache.hits", "cache", "artifact");
    this.artifactMissCounter = meterRegistry.counter("consolidator.chart.cache.misses", "cache", "artifact");
    this.renderCounter = meterRegistry.counter("consolidator.chart.renders");
  }

  /**
   * Returns the series of a window, recomputed at most once per TTL.
   *
   * @param windowType window to chart
   * @return cached or freshly extracted series
   */
  public ChartSeries getChartSeries(WindowType windowType) {
    Optional<ChartSeries> cached = seriesCache.get(windowType);
    if (cached.isPresent()) {
      seriesHitCounter.increment();
      return cached.get();
    }
    seriesMissCounter.increment();
    ChartSeries series = extractor.extract(windowType);
    seriesCache.put(windowType, series);
    return series;
  }

  /**
   * Renders a window with its default palette.
   *
   * @param windowType window to chart
   * @param artifactName base file name of the chart
   * @param controllersActive whether a controller is currently on duty (live palette only)
   * @return path of the chart file
   */
  public Path renderChart(WindowType windowType, String artifactName, boolean controllersActive) {
    ChartPalette palette = ChartPalette.forWindow(windowType, controllersActive);
    return renderChart(windowType, artifactName, palette.primary(), palette.secondary());
  }

  /**
   * Returns the chart file for the given parameters, rendering it when no fresh copy exists.
   *
   * @param windowType window to chart
   * @param artifactName base file name of the chart
   * @param primaryColor pilot line color, {@code #RRGGBB}
   * @param secondaryColor controller line color, {@code #RRGGBB}
   * @return path of the chart file
   * @throws UncheckedIOException when the file cannot be written
   */
  public Path renderChart(WindowType windowType, String artifactName, String primaryColor, String secondaryColor) {
    ChartKey key = new ChartKey(windowType, artifactName, primaryColor, secondaryColor);
    Optional<Path> cached = artifactCache.get(key);
    if (cached.isPresent()) {
      artifactHitCounter.increment();
      return cached.get();
    }

    ChartSeries series = getChartSeries(windowType);
    renderLock.lock();
    try {
      // Another thread may have rendered the same chart while this one waited.
      Optional<Path> rendered = artifactCache.get(key);
      if (rendered.isPresent()) {
        artifactHitCounter.increment();
        return rendered.get();
      }
      artifactMissCounter.increment();
      Path target = outputDir.resolve(key.fileName());
      renderer.render(series, new ChartPalette(primaryColor, secondaryColor), target);
      renderCounter.increment();
      artifactCache.put(key, target);
      log.debug("Rendered {} chart to {}", windowType, target);
      return target;
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render " + windowType + " chart", ex);
    } finally {
      renderLock.unlock();
    }
  }

  /** Evicts entries older than twice the TTL, deleting their chart files. */
  @Scheduled(
      fixedDelayString = "${consolidator.chart.sweep-interval-seconds:300}",
      timeUnit = TimeUnit.SECONDS)
  public void sweepExpired() {
    int series = seriesCache.sweep();
    int artifacts = artifactCache.sweep();
    if (series + artifacts > 0) {
      log.info("Chart cache sweep evicted {} series and {} artifacts", series, artifacts);
    }
  }

  private void deleteArtifact(ChartKey key, Path path) {
    evictionCounter.increment();
    try {
      Files.deleteIfExists(path);
    } catch (IOException ex) {
      log.warn("Failed to delete expired chart file {}", path, ex);
    }
  }

  /**
   * Cache key of a rendered chart.
   *
   * @param windowType charted window
   * @param name artifact base name
   * @param primaryColor pilot line color
   * @param secondaryColor controller line color
   */
  record ChartKey(WindowType windowType, String name, String primaryColor, String secondaryColor) {

    String fileName() {
      return String.format(
          "%s_%s_%s_%s.png",
          sanitize(name),
          windowType.name().toLowerCase(Locale.ROOT),
          sanitize(primaryColor),
          sanitize(secondaryColor));
    }

    private static String sanitize(String raw) {
      return raw == null ? "none" : raw.replaceAll("[^A-Za-z0-9-]", "");
    }
  }
}

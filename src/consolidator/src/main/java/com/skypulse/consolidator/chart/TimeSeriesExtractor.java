package com.skypulse.consolidator.chart;

import com.skypulse.consolidator.model.ChartSeries;
import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.model.Sample;
import com.skypulse.consolidator.model.StoredSample;
import com.skypulse.consolidator.model.WindowType;
import com.skypulse.consolidator.store.DailyCount;
import com.skypulse.consolidator.store.SampleCount;
import com.skypulse.consolidator.store.SnapshotRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Reads chart-ready series out of the snapshot store.
 *
 * <p>Live and daily windows get one point per sample. Weekly and monthly windows get one point
 * per UTC calendar day from the window start through today, with missing days filled with zero.
 */
@Component
public class TimeSeriesExtractor {
  static final DateTimeFormatter TIME_LABEL = DateTimeFormatter.ofPattern("HH:mm").withZone(ZoneOffset.UTC);
  static final DateTimeFormatter DAY_LABEL = DateTimeFormatter.ofPattern("dd/MM");

  private final SnapshotRepository repository;
  private final Clock clock;

  public TimeSeriesExtractor(SnapshotRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  public ChartSeries extract(WindowType windowType) {
    Instant now = clock.instant();
    Instant start = windowType.start(now);
    if (windowType.perDaySeries()) {
      return perDay(windowType, start, now);
    }
    return perSample(windowType, start, now);
  }

  private ChartSeries perSample(WindowType windowType, Instant start, Instant now) {
    List<SampleCount> counts = repository.sampleCounts(windowType.partition(), start, now);
    if (counts.isEmpty()) {
      return fallback(windowType, start, now);
    }
    List<ChartSeries.Point> points = new ArrayList<>(counts.size());
    for (SampleCount count : counts) {
      points.add(new ChartSeries.Point(TIME_LABEL.format(count.timestamp()), count.flights(), count.sessions()));
    }
    return new ChartSeries(windowType, points);
  }

  /**
   * Flat two-point series from the last known sample, or zeros when nothing was ever stored,
   * so renderers never receive an empty series.
   */
  private ChartSeries fallback(WindowType windowType, Instant start, Instant now) {
    Optional<StoredSample> latest = repository.latest(Partition.SHORT);
    if (latest.isEmpty()) {
      return new ChartSeries(windowType, List.of(
          new ChartSeries.Point("00:00", 0, 0),
          new ChartSeries.Point(TIME_LABEL.format(now), 0, 0)));
    }
    Sample sample = latest.get().sample();
    int pilots = sample.flights().size();
    int controllers = sample.sessions().size();
    return new ChartSeries(windowType, List.of(
        new ChartSeries.Point(TIME_LABEL.format(start), pilots, controllers),
        new ChartSeries.Point(TIME_LABEL.format(now), pilots, controllers)));
  }

  private ChartSeries perDay(WindowType windowType, Instant start, Instant now) {
    Map<LocalDate, DailyCount> byDay = new HashMap<>();
    for (DailyCount count : repository.dailyParticipantCounts(windowType.partition(), start)) {
      byDay.put(count.day(), count);
    }
    LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
    List<ChartSeries.Point> points = new ArrayList<>();
    for (LocalDate day = LocalDate.ofInstant(start, ZoneOffset.UTC); !day.isAfter(today); day = day.plusDays(1)) {
      DailyCount count = byDay.get(day);
      points.add(new ChartSeries.Point(
          DAY_LABEL.format(day),
          count == null ? 0 : count.pilots(),
          count == null ? 0 : count.controllers()));
    }
    return new ChartSeries(windowType, points);
  }
}

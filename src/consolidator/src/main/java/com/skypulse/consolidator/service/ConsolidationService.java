package com.skypulse.consolidator.service;

import com.skypulse.consolidator.chart.ChartService;
import com.skypulse.consolidator.config.ConsolidatorProperties;
import com.skypulse.consolidator.model.ActiveFlight;
import com.skypulse.consolidator.model.ChartSeries;
import com.skypulse.consolidator.model.FlightCategory;
import com.skypulse.consolidator.model.FlightRecord;
import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.model.Sample;
import com.skypulse.consolidator.model.SessionRecord;
import com.skypulse.consolidator.model.Statistics;
import com.skypulse.consolidator.model.StoredSample;
import com.skypulse.consolidator.model.WindowType;
import com.skypulse.consolidator.region.RegionClassifier;
import com.skypulse.consolidator.region.RegionConfigProvider;
import com.skypulse.consolidator.region.RegionPrefixes;
import com.skypulse.consolidator.stats.SessionContinuityTracker;
import com.skypulse.consolidator.stats.StatisticsAggregator;
import com.skypulse.consolidator.store.SnapshotRepository;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Entry point for reports: composes store, aggregator, tracker and chart cache.
 *
 * <p>Region prefixes are read from {@link RegionConfigProvider} on every call and handed to the
 * aggregator, so a prefix reload takes effect on the next query.
 *
 * <p>Each report runs its queries in one read-only transaction. Under WAL every query of the
 * report then reads the same snapshot, even when a collection cycle commits halfway through.
 */
@Service
public class ConsolidationService {
  private static final Logger log = LoggerFactory.getLogger(ConsolidationService.class);

  private final SnapshotRepository repository;
  private final StatisticsAggregator aggregator;
  private final SessionContinuityTracker tracker;
  private final ChartService chartService;
  private final RegionConfigProvider regionConfig;
  private final Optional<WeatherProvider> weatherProvider;
  private final TransactionTemplate readSnapshot;
  private final Clock clock;
  private final Duration shortHorizon;

  public ConsolidationService(
      SnapshotRepository repository,
      StatisticsAggregator aggregator,
      SessionContinuityTracker tracker,
      ChartService chartService,
      RegionConfigProvider regionConfig,
      Optional<WeatherProvider> weatherProvider,
      PlatformTransactionManager transactionManager,
      Clock clock,
      ConsolidatorProperties properties) {
    this.repository = repository;
    this.aggregator = aggregator;
    this.tracker = tracker;
    this.chartService = chartService;
    this.regionConfig = regionConfig;
    this.weatherProvider = weatherProvider;
    this.readSnapshot = new TransactionTemplate(transactionManager);
    this.readSnapshot.setReadOnly(true);
    this.clock = clock;
    this.shortHorizon = Duration.ofHours(properties.getRetention().getShortHorizonHours());
  }

  /**
   * Builds the live report from the latest sample of a partition.
   *
   * <p>Flight and controller lists come from the latest sample, filtered with the current
   * prefixes. Person-minutes cover the current UTC day.
   *
   * @param partition partition to read the latest sample from
   * @return live statistics, empty when the partition holds no sample
   */
  public Optional<Statistics> getLiveStatistics(Partition partition) {
    Optional<Statistics> statistics = readSnapshot.execute(status -> liveStatistics(partition));
    return statistics.map(this::withWeather);
  }

  private Optional<Statistics> liveStatistics(Partition partition) {
    Optional<StoredSample> latest = repository.latest(partition);
    if (latest.isEmpty()) {
      return Optional.empty();
    }
    RegionPrefixes prefixes = regionConfig.current();
    RegionClassifier classifier = new RegionClassifier(prefixes);
    Sample sample = latest.get().sample();

    Set<ActiveFlight> seen = new LinkedHashSet<>();
    Set<String> pilots = new HashSet<>();
    int domestic = 0;
    int outgoing = 0;
    int incoming = 0;
    long peopleOnBoard = 0;
    for (FlightRecord flight : sample.flights()) {
      FlightCategory category = classifier.categorize(flight);
      if (category == FlightCategory.UNRELATED) {
        continue;
      }
      ActiveFlight active = new ActiveFlight(
          flight.callsign(),
          flight.departure(),
          flight.arrival(),
          flight.route(),
          flight.seats(),
          flight.aircraftType(),
          category);
      if (!seen.add(active)) {
        continue;
      }
      pilots.add(flight.subjectKey());
      peopleOnBoard += flight.seats();
      switch (category) {
        case DOMESTIC -> domestic++;
        case OUTGOING -> outgoing++;
        case INCOMING -> incoming++;
        default -> { }
      }
    }

    Map<String, SessionRecord> controllers = new LinkedHashMap<>();
    for (SessionRecord session : sample.sessions()) {
      if (classifier.isInScopeController(session)) {
        controllers.putIfAbsent(session.callsign(), session);
      }
    }

    List<ActiveFlight> activeFlights = new ArrayList<>(seen);
    activeFlights.sort(Comparator.comparing(ActiveFlight::callsign));
    Instant dayStart = WindowType.DAILY.start(clock.instant());
    return Optional.of(new Statistics(
        activeFlights.size(),
        domestic,
        outgoing,
        incoming,
        pilots.size(),
        peopleOnBoard,
        aggregator.flightMinutes(partition, dayStart, prefixes),
        aggregator.controlMinutes(partition, dayStart, prefixes),
        controllers.size(),
        activeFlights,
        new ArrayList<>(controllers.values()),
        null,
        null,
        null,
        null));
  }

  /**
   * Builds the window report of a partition since {@code windowStart}.
   *
   * @param partition partition backing the window
   * @param windowStart inclusive window start
   * @return window statistics, empty when the window holds no sample
   */
  public Optional<Statistics> getWindowStatistics(Partition partition, Instant windowStart) {
    RegionPrefixes prefixes = regionConfig.current();
    return readSnapshot.execute(status -> {
      if (repository.countSamples(partition, windowStart) == 0) {
        return Optional.empty();
      }
      return Optional.of(aggregator.windowStatistics(
          partition, windowStart, prefixes, StatisticsAggregator.DEFAULT_TOP_N));
    });
  }

  /** Window report for a named window; {@link WindowType#LIVE} yields the live report. */
  public Optional<Statistics> getWindowStatistics(WindowType windowType) {
    if (windowType == WindowType.LIVE) {
      return getLiveStatistics(windowType.partition());
    }
    return getWindowStatistics(windowType.partition(), windowType.start(clock.instant()));
  }

  public Map<String, Integer> getControllerSessionMinutes(Collection<String> callsigns) {
    return tracker.sessionMinutes(callsigns);
  }

  public ChartSeries getChartSeries(WindowType windowType) {
    return chartService.getChartSeries(windowType);
  }

  /**
   * Renders the chart of a window with its default palette.
   *
   * @param windowType window to chart
   * @return chart file
   */
  public Path renderChart(WindowType windowType) {
    boolean controllersActive = repository.latest(Partition.SHORT)
        .map(stored -> {
          RegionClassifier classifier = new RegionClassifier(regionConfig.current());
          return stored.sample().sessions().stream().anyMatch(classifier::isInScopeController);
        })
        .orElse(false);
    return chartService.renderChart(windowType, "activity", controllersActive);
  }

  /** Drops short-partition samples older than the retention horizon. */
  public int pruneShortWindow() {
    return repository.prune(Partition.SHORT, clock.instant().minus(shortHorizon));
  }

  public void resetMediumWindow() {
    repository.reset(Partition.MEDIUM);
  }

  public void resetLongWindow() {
    repository.reset(Partition.LONG);
  }

  private Statistics withWeather(Statistics statistics) {
    if (weatherProvider.isEmpty()) {
      return statistics;
    }
    try {
      return weatherProvider.get().currentWeather().map(statistics::withWeather).orElse(statistics);
    } catch (RuntimeException ex) {
      log.warn("Weather lookup failed; live report sent without weather", ex);
      return statistics;
    }
  }
}

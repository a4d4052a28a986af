package com.skypulse.consolidator.service;

import com.skypulse.consolidator.model.FlightRecord;
import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.model.Sample;
import com.skypulse.consolidator.model.SessionRecord;
import com.skypulse.consolidator.region.RegionClassifier;
import com.skypulse.consolidator.region.RegionConfigProvider;
import com.skypulse.consolidator.store.SnapshotRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validates raw flights and sessions and writes the resulting sample into every partition.
 *
 * <p>Records without callsign or subject id, flights not touching the region and controllers
 * out of scope are dropped and counted; they never reach the store.
 */
@Service
public class SnapshotIngestService {
  private static final Logger log = LoggerFactory.getLogger(SnapshotIngestService.class);

  private final SnapshotRepository repository;
  private final RegionConfigProvider regionConfig;
  private final Counter sampleCounter;
  private final Counter failedSampleCounter;
  private final Counter droppedFlightCounter;
  private final Counter droppedSessionCounter;

  public SnapshotIngestService(
      SnapshotRepository repository, RegionConfigProvider regionConfig, MeterRegistry meterRegistry) {
    this.repository = repository;
    this.regionConfig = regionConfig;
    this.sampleCounter = meterRegistry.counter("consolidator.ingest.samples.total");
    this.failedSampleCounter = meterRegistry.counter("consolidator.ingest.samples.partial");
    this.droppedFlightCounter = meterRegistry.counter("consolidator.ingest.records.dropped", "kind", "flight");
    this.droppedSessionCounter = meterRegistry.counter("consolidator.ingest.records.dropped", "kind", "session");
  }

  /**
   * Stores one sample.
   *
   * @param timestamp capture time, truncated to the second
   * @param flights raw flights, may contain malformed entries
   * @param sessions raw controller sessions, may contain malformed entries
   * @return per-partition outcome
   */
  public IngestResult ingest(Instant timestamp, List<FlightRecord> flights, List<SessionRecord> sessions) {
    Objects.requireNonNull(timestamp, "timestamp");
    RegionClassifier classifier = new RegionClassifier(regionConfig.current());

    List<FlightRecord> keptFlights = new ArrayList<>();
    int droppedFlights = 0;
    for (FlightRecord raw : flights == null ? List.<FlightRecord>of() : flights) {
      FlightRecord flight = raw == null ? null : normalize(raw);
      if (flight == null || isBlank(flight.callsign()) || isBlank(flight.subjectId())
          || !classifier.involvesRegion(flight)) {
        droppedFlights++;
        log.debug("Dropping flight {}", raw);
        continue;
      }
      keptFlights.add(flight);
    }

    List<SessionRecord> keptSessions = new ArrayList<>();
    int droppedSessions = 0;
    for (SessionRecord raw : sessions == null ? List.<SessionRecord>of() : sessions) {
      SessionRecord session = raw == null ? null : normalize(raw);
      if (session == null || isBlank(session.callsign()) || isBlank(session.subjectId())
          || !classifier.isInScopeController(session)) {
        droppedSessions++;
        log.debug("Dropping controller session {}", raw);
        continue;
      }
      keptSessions.add(session);
    }
    droppedFlightCounter.increment(droppedFlights);
    droppedSessionCounter.increment(droppedSessions);

    Sample sample = new Sample(timestamp.truncatedTo(ChronoUnit.SECONDS), keptFlights, keptSessions);
    Map<Partition, Boolean> outcome = repository.store(sample);
    IngestResult result = new IngestResult(
        outcome, keptFlights.size(), keptSessions.size(), droppedFlights + droppedSessions);

    sampleCounter.increment();
    if (!result.success()) {
      failedSampleCounter.increment();
      log.warn("Sample {} stored partially: {}", sample.timestamp(), outcome);
    }
    log.info("Ingested sample {}: {} flights, {} controllers, {} dropped",
        sample.timestamp(), keptFlights.size(), keptSessions.size(), result.droppedRecords());
    return result;
  }

  private static FlightRecord normalize(FlightRecord flight) {
    return new FlightRecord(
        trimToNull(flight.subjectId()),
        upper(flight.callsign()),
        upper(flight.departure()),
        upper(flight.arrival()),
        flight.route(),
        Math.max(0, flight.seats()),
        upper(flight.aircraftType()));
  }

  private static SessionRecord normalize(SessionRecord session) {
    return new SessionRecord(
        trimToNull(session.subjectId()), upper(session.callsign()), session.frequency(), session.status());
  }

  private static String upper(String value) {
    return value == null ? null : value.trim().toUpperCase(Locale.ROOT);
  }

  private static String trimToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}

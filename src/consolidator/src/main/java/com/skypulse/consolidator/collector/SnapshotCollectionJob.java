package com.skypulse.consolidator.collector;

import com.skypulse.consolidator.model.FlightRecord;
import com.skypulse.consolidator.model.SessionRecord;
import com.skypulse.consolidator.service.IngestResult;
import com.skypulse.consolidator.service.SnapshotIngestService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the network on a fixed delay and ingests one sample per successful fetch.
 */
@Component
@ConditionalOnProperty(
    prefix = "consolidator.collector",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SnapshotCollectionJob {
  private static final Logger log = LoggerFactory.getLogger(SnapshotCollectionJob.class);

  private final NetworkSnapshotClient client;
  private final SnapshotIngestService ingestService;
  private final Clock clock;
  private final Counter cycleCounter;
  private final Counter skippedCounter;
  private final Counter errorCounter;
  private final AtomicLong lastSampleEpochSeconds = new AtomicLong(0);

  public SnapshotCollectionJob(
      NetworkSnapshotClient client,
      SnapshotIngestService ingestService,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.client = client;
    this.ingestService = ingestService;
    this.clock = clock;
    this.cycleCounter = meterRegistry.counter("consolidator.ingest.cycles.total");
    this.skippedCounter = meterRegistry.counter("consolidator.ingest.cycles.skipped");
    this.errorCounter = meterRegistry.counter("consolidator.ingest.errors.total");
    meterRegistry.gauge("consolidator.ingest.last_sample.epoch_seconds", lastSampleEpochSeconds);
  }

  @Scheduled(fixedDelayString = "${consolidator.collector.refresh-ms:60000}")
  public void collect() {
    cycleCounter.increment();
    try {
      Optional<NetworkSnapshotPayload> payload = client.fetch();
      if (payload.isEmpty()) {
        skippedCounter.increment();
        return;
      }
      List<FlightRecord> flights = SnapshotPayloadMapper.flights(payload.get());
      List<SessionRecord> sessions = SnapshotPayloadMapper.sessions(payload.get());
      IngestResult result = ingestService.ingest(clock.instant(), flights, sessions);
      if (result.success()) {
        lastSampleEpochSeconds.set(clock.instant().getEpochSecond());
      }
    } catch (Exception ex) {
      // Keep the scheduler running even if a cycle fails.
      errorCounter.increment();
      log.error("Collection cycle failed", ex);
    }
  }
}

package com.skypulse.consolidator.collector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.skypulse.consolidator.model.FlightRecord;
import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.service.IngestResult;
import com.skypulse.consolidator.service.SnapshotIngestService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SnapshotCollectionJobTest {
  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

  private NetworkSnapshotClient client;
  private SnapshotIngestService ingestService;
  private SimpleMeterRegistry meterRegistry;
  private SnapshotCollectionJob job;

  @BeforeEach
  void setUp() {
    client = mock(NetworkSnapshotClient.class);
    ingestService = mock(SnapshotIngestService.class);
    meterRegistry = new SimpleMeterRegistry();
    job = new SnapshotCollectionJob(client, ingestService, Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);
  }

  @Test
  void collectIngestsMappedRecordsAtCurrentTime() {
    NetworkSnapshotPayload payload = new NetworkSnapshotPayload(new NetworkSnapshotPayload.Clients(
        List.of(new NetworkSnapshotPayload.Pilot(
            "1",
            "afr1",
            new NetworkSnapshotPayload.FlightPlan(
                "LFPG", "LFMN", 120, "DCT", new NetworkSnapshotPayload.Aircraft("A320")))),
        List.of()));
    when(client.fetch()).thenReturn(Optional.of(payload));
    when(ingestService.ingest(eq(NOW), anyList(), anyList()))
        .thenReturn(new IngestResult(Map.of(Partition.SHORT, true), 1, 0, 0));

    job.collect();

    verify(ingestService).ingest(
        NOW,
        List.of(new FlightRecord("1", "AFR1", "LFPG", "LFMN", "DCT", 120, "A320")),
        List.of());
    assertThat(meterRegistry.get("consolidator.ingest.cycles.total").counter().count()).isEqualTo(1.0);
    assertThat(meterRegistry.get("consolidator.ingest.cycles.skipped").counter().count()).isZero();
  }

  @Test
  void failedFetchSkipsTheCycle() {
    when(client.fetch()).thenReturn(Optional.empty());

    job.collect();

    verifyNoInteractions(ingestService);
    assertThat(meterRegistry.get("consolidator.ingest.cycles.skipped").counter().count()).isEqualTo(1.0);
  }

  @Test
  void ingestionFailureIsCountedAndDoesNotEscape() {
    when(client.fetch()).thenReturn(Optional.of(new NetworkSnapshotPayload(null)));
    when(ingestService.ingest(any(), anyList(), anyList())).thenThrow(new IllegalStateException("boom"));

    job.collect();

    assertThat(meterRegistry.get("consolidator.ingest.errors.total").counter().count()).isEqualTo(1.0);
  }
}

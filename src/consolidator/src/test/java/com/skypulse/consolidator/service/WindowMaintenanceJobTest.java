package com.skypulse.consolidator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class WindowMaintenanceJobTest {
  private ConsolidationService consolidationService;
  private SimpleMeterRegistry meterRegistry;
  private WindowMaintenanceJob job;

  @BeforeEach
  void setUp() {
    consolidationService = mock(ConsolidationService.class);
    meterRegistry = new SimpleMeterRegistry();
    job = new WindowMaintenanceJob(consolidationService, meterRegistry);
  }

  @Test
  void pruneCountsRemovedSamples() {
    when(consolidationService.pruneShortWindow()).thenReturn(7);

    job.pruneShortWindow();

    assertThat(meterRegistry.get("consolidator.retention.prune.samples").counter().count()).isEqualTo(7.0);
  }

  @Test
  void resetFailureIsCountedAndDoesNotEscape() {
    doThrow(new DataAccessResourceFailureException("database is locked"))
        .when(consolidationService).resetMediumWindow();

    job.resetMediumWindow();
    job.resetLongWindow();

    verify(consolidationService).resetLongWindow();
    assertThat(meterRegistry.get("consolidator.retention.failures")
        .tag("action", "reset_medium").counter().count()).isEqualTo(1.0);
  }
}

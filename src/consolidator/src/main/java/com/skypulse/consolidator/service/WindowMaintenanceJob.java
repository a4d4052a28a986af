package com.skypulse.consolidator.service;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Applies partition retention: rolling prune of the short window, full resets of the medium and
 * long windows at their boundaries (cron expressions are evaluated in UTC).
 */
@Component
@ConditionalOnProperty(
    prefix = "consolidator.retention",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class WindowMaintenanceJob {
  private static final Logger log = LoggerFactory.getLogger(WindowMaintenanceJob.class);

  private final ConsolidationService consolidationService;
  private final MeterRegistry meterRegistry;

  public WindowMaintenanceJob(ConsolidationService consolidationService, MeterRegistry meterRegistry) {
    this.consolidationService = consolidationService;
    this.meterRegistry = meterRegistry;
  }

  @Scheduled(cron = "${consolidator.retention.prune-cron:0 5 * * * *}", zone = "UTC")
  public void pruneShortWindow() {
    try {
      int removed = consolidationService.pruneShortWindow();
      meterRegistry.counter("consolidator.retention.prune.samples").increment(removed);
    } catch (Exception ex) {
      log.error("Failed to prune the short window", ex);
      meterRegistry.counter("consolidator.retention.failures", "action", "prune").increment();
    }
  }

  @Scheduled(cron = "${consolidator.retention.medium-reset-cron:0 0 0 * * MON}", zone = "UTC")
  public void resetMediumWindow() {
    try {
      consolidationService.resetMediumWindow();
      log.info("Medium window reset at week boundary");
    } catch (Exception ex) {
      log.error("Failed to reset the medium window", ex);
      meterRegistry.counter("consolidator.retention.failures", "action", "reset_medium").increment();
    }
  }

  @Scheduled(cron = "${consolidator.retention.long-reset-cron:0 0 0 1 * *}", zone = "UTC")
  public void resetLongWindow() {
    try {
      consolidationService.resetLongWindow();
      log.info("Long window reset at month boundary");
    } catch (Exception ex) {
      log.error("Failed to reset the long window", ex);
      meterRegistry.counter("consolidator.retention.failures", "action", "reset_long").increment();
    }
  }
}

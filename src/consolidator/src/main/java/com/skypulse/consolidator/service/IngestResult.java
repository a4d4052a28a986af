package com.skypulse.consolidator.service;

import com.skypulse.consolidator.model.Partition;
import java.util.Map;

/**
 * Outcome of one ingestion call.
 *
 * @param partitions write outcome per partition
 * @param storedFlights flights kept after validation
 * @param storedSessions sessions kept after validation
 * @param droppedRecords flights and sessions rejected by validation
 */
public record IngestResult(
    Map<Partition, Boolean> partitions, int storedFlights, int storedSessions, int droppedRecords) {

  public IngestResult {
    partitions = Map.copyOf(partitions);
  }

  /** {@code true} only when every partition write committed. */
  public boolean success() {
    return !partitions.isEmpty() && partitions.values().stream().allMatch(Boolean::booleanValue);
  }
}

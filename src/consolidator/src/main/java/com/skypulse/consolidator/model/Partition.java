package com.skypulse.consolidator.model;

/**
 * One of the three independently retained copies of the sample stream.
 *
 * <p>Every ingested sample is written identically into all partitions. Each partition owns its
 * own table group and its own monotonically increasing sample ids.
 */
public enum Partition {
  SHORT("day"),
  MEDIUM("week"),
  LONG("month");

  private final String tableSuffix;

  Partition(String tableSuffix) {
    this.tableSuffix = tableSuffix;
  }

  public String samplesTable() {
    return "samples_" + tableSuffix;
  }

  public String flightsTable() {
    return "flight_records_" + tableSuffix;
  }

  public String sessionsTable() {
    return "session_records_" + tableSuffix;
  }

  /** Stable lower-case label used in logs and metric tags. */
  public String label() {
    return name().toLowerCase();
  }
}

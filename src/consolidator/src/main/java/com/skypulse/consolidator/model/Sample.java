package com.skypulse.consolidator.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable point-in-time capture of all active flights and controller sessions.
 *
 * @param timestamp capture time (UTC)
 * @param flights flights present in the capture
 * @param sessions controller sessions present in the capture
 */
public record Sample(Instant timestamp, List<FlightRecord> flights, List<SessionRecord> sessions) {

  public Sample {
    Objects.requireNonNull(timestamp, "timestamp");
    flights = flights == null ? List.of() : List.copyOf(flights);
    sessions = sessions == null ? List.of() : List.copyOf(sessions);
  }
}

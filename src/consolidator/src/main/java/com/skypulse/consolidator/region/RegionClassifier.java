package com.skypulse.consolidator.region;

import com.skypulse.consolidator.model.FlightCategory;
import com.skypulse.consolidator.model.FlightRecord;
import com.skypulse.consolidator.model.SessionRecord;
import java.util.Objects;

/**
 * Stateless region classification for flights and controller sessions.
 *
 * <p>An instance is bound to one prefix snapshot; callers build a new classifier from whatever
 * {@link RegionConfigProvider#current()} returns at query time.
 */
public final class RegionClassifier {
  private final RegionPrefixes prefixes;

  public RegionClassifier(RegionPrefixes prefixes) {
    this.prefixes = Objects.requireNonNull(prefixes, "prefixes");
  }

  public RegionPrefixes prefixes() {
    return prefixes;
  }

  public boolean isDomestic(FlightRecord flight) {
    return prefixes.matches(flight.departure()) && prefixes.matches(flight.arrival());
  }

  public boolean isOutgoing(FlightRecord flight) {
    return prefixes.matches(flight.departure()) && !prefixes.matches(flight.arrival());
  }

  public boolean isIncoming(FlightRecord flight) {
    return !prefixes.matches(flight.departure()) && prefixes.matches(flight.arrival());
  }

  public boolean involvesRegion(FlightRecord flight) {
    return prefixes.matches(flight.departure()) || prefixes.matches(flight.arrival());
  }

  public boolean isInScopeController(SessionRecord session) {
    return prefixes.matches(session.callsign());
  }

  /**
   * Returns the single category of a flight.
   *
   * @param flight flight to classify
   * @return category; {@link FlightCategory#UNRELATED} when no endpoint is in the region
   */
  public FlightCategory categorize(FlightRecord flight) {
    boolean departureIn = prefixes.matches(flight.departure());
    boolean arrivalIn = prefixes.matches(flight.arrival());
    if (departureIn && arrivalIn) {
      return FlightCategory.DOMESTIC;
    }
    if (departureIn) {
      return FlightCategory.OUTGOING;
    }
    if (arrivalIn) {
      return FlightCategory.INCOMING;
    }
    return FlightCategory.UNRELATED;
  }
}
